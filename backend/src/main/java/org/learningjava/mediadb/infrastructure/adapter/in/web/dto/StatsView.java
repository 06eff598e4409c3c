package org.learningjava.mediadb.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.learningjava.mediadb.domain.model.CollectionStats;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatsView(
        long totalAssets,
        long images,
        long videos,
        double totalSizeMb,
        Map<String, Long> sources,
        Double avgQuality,
        long ratedCount,
        long unratedCount,
        long unembeddedCount
) {
    public static StatsView from(CollectionStats s) {
        return new StatsView(s.totalAssets(), s.images(), s.videos(), s.totalSizeMb(), s.sources(),
                s.avgQuality(), s.ratedCount(), s.unratedCount(), s.unembeddedCount());
    }
}
