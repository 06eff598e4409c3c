package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.application.port.EmbeddingPort;
import org.learningjava.mediadb.application.port.FrameExtractorPort;
import org.learningjava.mediadb.application.port.MediaFilePort;
import org.learningjava.mediadb.application.port.MediaProbePort;
import org.learningjava.mediadb.domain.exception.ExternalServiceException;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.domain.model.Content;
import org.learningjava.mediadb.domain.model.DirectoryImportRequest;
import org.learningjava.mediadb.domain.model.Embedding;
import org.learningjava.mediadb.domain.model.IngestOptions;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.domain.model.TechnicalSpecs;
import org.learningjava.mediadb.domain.model.VideoProbe;
import org.learningjava.mediadb.domain.service.FilenameMetadataParser;
import org.learningjava.mediadb.domain.service.FilenameMetadataParser.FilenameMetadata;
import org.learningjava.mediadb.domain.service.ImageInspector;
import org.learningjava.mediadb.domain.service.MediaFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns files on disk (or uploaded bytes) into stored assets: reads, inspects, embeds, appends.
 */
@Service
public class IngestMediaUseCase {

    private static final Logger log = LoggerFactory.getLogger(IngestMediaUseCase.class);

    /** Progress callback for long-running directory imports. */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int processed, int total);

        ProgressListener NONE = (processed, total) -> { };
    }

    private final AssetStorePort store;
    private final EmbeddingPort embedding;
    private final FrameExtractorPort frames;
    private final MediaProbePort probe;
    private final MediaFilePort files;
    private final FilenameMetadataParser filenameParser;
    private final Clock clock;
    private final Duration thumbnailOffset;

    public IngestMediaUseCase(
            AssetStorePort store,
            EmbeddingPort embedding,
            FrameExtractorPort frames,
            MediaProbePort probe,
            MediaFilePort files,
            Clock clock,
            @Value("${mediadb.video.thumbnail-offset-seconds:1}") double thumbnailOffsetSeconds
    ) {
        this.store = store;
        this.embedding = embedding;
        this.frames = frames;
        this.probe = probe;
        this.files = files;
        this.filenameParser = new FilenameMetadataParser();
        this.clock = clock;
        this.thumbnailOffset = Duration.ofMillis(Math.round(thumbnailOffsetSeconds * 1000));
    }

    public UUID addImage(Path path, IngestOptions options) {
        return addImage(path, null, options);
    }

    public UUID addImage(Path path, String filename, IngestOptions options) {
        requireExists(path);
        byte[] bytes = files.readAll(path);
        return addImageBytes(bytes, filename != null ? filename : path.getFileName().toString(), options);
    }

    public UUID addImageBytes(byte[] bytes, String filename, IngestOptions options) {
        requireFilename(filename);
        IngestOptions opts = options != null ? options : IngestOptions.none();

        ImageInspector.Dimensions dims = ImageInspector.dimensions(bytes);
        Embedding vector = toEmbedding(embedding.encodeImage(bytes));

        MediaAsset asset = newAsset(filename, MediaType.IMAGE, vector,
                new TechnicalSpecs(dims.width(), dims.height(), null, bytes.length, MediaFormats.normalizedFormat(filename)),
                opts, false);
        store.append(asset, Content.image(bytes));
        log.info("Added image {} ({}x{}, {} bytes) as {}", filename, dims.width(), dims.height(), bytes.length, asset.id());
        return asset.id();
    }

    public UUID addVideo(Path path, IngestOptions options) {
        return addVideo(path, null, null, options);
    }

    public UUID addVideo(Path path, String filename, byte[] suppliedThumbnail, IngestOptions options) {
        requireExists(path);
        String name = filename != null ? filename : path.getFileName().toString();
        IngestOptions opts = options != null ? options : IngestOptions.none();
        byte[] bytes = files.readAll(path);

        byte[] thumbnail = suppliedThumbnail != null && suppliedThumbnail.length > 0
                ? suppliedThumbnail
                : frames.extractFrame(path, thumbnailOffset).orElse(null);

        Embedding vector = Embedding.unavailable();
        if (thumbnail == null) {
            log.warn("No thumbnail for video {}; storing without embedding", name);
        } else {
            try {
                vector = toEmbedding(embedding.encodeImage(thumbnail));
            } catch (ExternalServiceException e) {
                log.warn("Embedding failed for video {}; storing without embedding: {}", name, e.getMessage());
            }
        }

        VideoProbe p = Optional.ofNullable(probe.probe(path)).orElse(VideoProbe.unknown());
        MediaAsset asset = newAsset(name, MediaType.VIDEO, vector,
                new TechnicalSpecs(p.width(), p.height(), p.durationSeconds(), bytes.length, MediaFormats.normalizedFormat(name)),
                opts, thumbnail != null);
        store.append(asset, Content.video(bytes, thumbnail));
        log.info("Added video {} ({}s, {} bytes, embedded={}) as {}", name, p.durationSeconds(), bytes.length,
                vector.isAvailable(), asset.id());
        return asset.id();
    }

    /**
     * Ingests uploaded video bytes. The probe and frame tools need a real file, so the bytes are
     * staged in a temp file that keeps the original extension.
     */
    public UUID addVideoBytes(byte[] bytes, String filename, byte[] suppliedThumbnail, IngestOptions options) {
        requireFilename(filename);
        Path tmp = null;
        try {
            String ext = MediaFormats.extension(filename);
            tmp = Files.createTempFile("mediadb-upload-", ext.isEmpty() ? ".bin" : "." + ext);
            Files.write(tmp, bytes);
            return addVideo(tmp, filename, suppliedThumbnail, options);
        } catch (IOException e) {
            throw new StorageException("Cannot stage upload " + filename, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.debug("Could not delete staged upload {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    public int importDirectory(DirectoryImportRequest request) {
        return importDirectory(request, ProgressListener.NONE);
    }

    /**
     * Imports every supported file under the directory. A failing file is logged and skipped.
     *
     * @return number of files successfully ingested
     */
    public int importDirectory(DirectoryImportRequest request, ProgressListener progress) {
        Path dir = request.directory();
        if (!Files.isDirectory(dir)) throw MediaNotFoundException.file(dir);

        List<Path> candidates = files.discover(dir, request.recursive());
        Set<String> existing = request.skipExisting() ? new HashSet<>(store.existingFilenames()) : new HashSet<>();

        int ingested = 0;
        int skipped = 0;
        int failed = 0;
        int processed = 0;
        for (Path file : candidates) {
            String name = file.getFileName().toString();
            if (request.skipExisting() && existing.contains(name)) {
                log.debug("Skipping existing {}", name);
                skipped++;
            } else {
                try {
                    IngestOptions opts = optionsFor(file, request);
                    MediaType type = MediaFormats.classify(file).orElseThrow(
                            () -> new IllegalArgumentException("Unsupported extension: " + name));
                    if (type == MediaType.IMAGE) {
                        addImage(file, name, opts);
                    } else {
                        addVideo(file, name, null, opts);
                    }
                    existing.add(name);
                    ingested++;
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Failed to import {}: {}", file, e.getMessage());
                }
            }
            processed++;
            progress.onProgress(processed, candidates.size());
        }
        log.info("Imported {} of {} files from {} (skipped={}, failed={})", ingested, candidates.size(), dir, skipped, failed);
        return ingested;
    }

    IngestOptions optionsFor(Path file, DirectoryImportRequest request) {
        IngestOptions.Builder b = IngestOptions.builder()
                .source(request.source())
                .contentType(request.contentType())
                .subjects(request.subjects())
                .styleTags(request.styleTags());
        if (!request.inferFromFilenames()) return b.build();

        FilenameMetadata meta = filenameParser.parse(file);
        return b.source(request.source() != null ? request.source() : meta.source())
                .contentType(request.contentType() != null ? request.contentType() : meta.contentType())
                .generationModel(meta.generationModel())
                .subjects(union(request.subjects(), meta.subjects()))
                .styleTags(union(request.styleTags(), meta.styleTags()))
                .episodes(meta.episodes())
                .build();
    }

    private static Set<String> union(Collection<String> a, Collection<String> b) {
        Set<String> out = new LinkedHashSet<>(a);
        out.addAll(b);
        return out;
    }

    private MediaAsset newAsset(String filename, MediaType type, Embedding vector, TechnicalSpecs specs,
                                IngestOptions opts, boolean hasThumbnail) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return new MediaAsset(
                UUID.randomUUID(),
                filename,
                type,
                vector,
                opts.provenance(),
                specs,
                opts.classification(),
                opts.qualityRating(),
                opts.qualityNotes(),
                opts.episodes(),
                0,
                now,
                null,
                hasThumbnail);
    }

    private static Embedding toEmbedding(float[] v) {
        try {
            return Embedding.computed(v);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ExternalServiceException("Embedding provider returned an invalid vector: " + e.getMessage(), e);
        }
    }

    private static void requireExists(Path path) {
        if (path == null || !Files.isRegularFile(path)) throw MediaNotFoundException.file(path);
    }

    private static void requireFilename(String filename) {
        if (filename == null || filename.isBlank()) throw new IllegalArgumentException("filename is required");
    }
}
