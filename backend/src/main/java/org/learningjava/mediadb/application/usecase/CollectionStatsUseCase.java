package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.domain.model.AssetFacts;
import org.learningjava.mediadb.domain.model.CollectionStats;
import org.learningjava.mediadb.domain.model.MediaType;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class CollectionStatsUseCase {

    static final String UNKNOWN_SOURCE = "unknown";

    private final AssetStorePort store;

    public CollectionStatsUseCase(AssetStorePort store) {
        this.store = store;
    }

    public CollectionStats stats() {
        List<AssetFacts> facts = store.scanFacts();
        long images = 0;
        long videos = 0;
        long bytes = 0;
        long rated = 0;
        long ratingSum = 0;
        long unembedded = 0;
        Map<String, Long> sources = new TreeMap<>();

        for (AssetFacts f : facts) {
            if (f.mediaType() == MediaType.IMAGE) images++;
            else videos++;
            bytes += f.fileSizeBytes();
            if (f.qualityRating() != null) {
                rated++;
                ratingSum += f.qualityRating();
            }
            if (!f.embedded()) unembedded++;
            sources.merge(f.source() != null ? f.source() : UNKNOWN_SOURCE, 1L, Long::sum);
        }

        Double avg = rated == 0 ? null : round((double) ratingSum / rated, 1);
        return new CollectionStats(
                facts.size(),
                images,
                videos,
                round(bytes / (1024.0 * 1024.0), 2),
                sources,
                avg,
                rated,
                facts.size() - rated,
                unembedded);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
