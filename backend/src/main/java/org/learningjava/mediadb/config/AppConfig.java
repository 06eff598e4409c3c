package org.learningjava.mediadb.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.application.port.EmbeddingPort;
import org.learningjava.mediadb.application.port.FrameExtractorPort;
import org.learningjava.mediadb.application.port.MediaProbePort;
import org.learningjava.mediadb.application.port.ProjectStorePort;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.infrastructure.adapter.out.clip.ClipEmbeddingAdapter;
import org.learningjava.mediadb.infrastructure.adapter.out.ffmpeg.FfmpegFrameExtractorAdapter;
import org.learningjava.mediadb.infrastructure.adapter.out.ffmpeg.FfprobeMediaProbeAdapter;
import org.learningjava.mediadb.infrastructure.adapter.out.sqlite.SqliteAssetStoreAdapter;
import org.learningjava.mediadb.infrastructure.adapter.out.sqlite.SqliteProjectStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    // base64 uploads of whole videos exceed Jackson's default string limit
    @Bean
    Jackson2ObjectMapperBuilderCustomizer largeUploads(
            @Value("${mediadb.http.max-json-string-mb:512}") int maxStringMb) {
        return builder -> builder.postConfigurer(om -> om.getFactory().setStreamReadConstraints(
                StreamReadConstraints.builder().maxStringLength(maxStringMb * 1024 * 1024).build()));
    }

    // SQLite in WAL mode; every pooled connection waits up to 5s on a locked database
    @Bean(destroyMethod = "close")
    HikariDataSource dataSource(StoreProperties props) {
        try {
            Files.createDirectories(props.getPath());
        } catch (IOException e) {
            throw new StorageException("Cannot create store directory " + props.getPath(), e);
        }
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("mediadb");
        cfg.setJdbcUrl("jdbc:sqlite:" + props.databaseFile().toAbsolutePath());
        cfg.setMaximumPoolSize(Math.max(1, props.getPoolSize()));
        cfg.setConnectionInitSql("PRAGMA busy_timeout = 5000");
        log.info("Opening media store at {}", props.databaseFile().toAbsolutePath());
        return new HikariDataSource(cfg);
    }

    //objects with external dependencies
    @Bean(initMethod = "ensureSchema")
    AssetStorePort assetStore(DataSource dataSource) {
        return new SqliteAssetStoreAdapter(dataSource);
    }

    @Bean(initMethod = "ensureSchema")
    ProjectStorePort projectStore(DataSource dataSource) {
        return new SqliteProjectStoreAdapter(dataSource);
    }

    @Bean
    EmbeddingPort embedding(@Value("${mediadb.clip.url}") String url,
                            @Value("${mediadb.clip.model}") String model,
                            @Value("${mediadb.clip.timeout-seconds:30}") long timeoutSeconds) {
        return new ClipEmbeddingAdapter(url, model, Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    FrameExtractorPort frameExtractor(@Value("${mediadb.ffmpeg.path:ffmpeg}") String ffmpeg,
                                      @Value("${mediadb.ffmpeg.timeout-seconds:60}") long timeoutSeconds) {
        return new FfmpegFrameExtractorAdapter(ffmpeg, Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    MediaProbePort mediaProbe(@Value("${mediadb.ffprobe.path:ffprobe}") String ffprobe,
                              @Value("${mediadb.ffmpeg.timeout-seconds:60}") long timeoutSeconds) {
        return new FfprobeMediaProbeAdapter(ffprobe, Duration.ofSeconds(timeoutSeconds));
    }
}
