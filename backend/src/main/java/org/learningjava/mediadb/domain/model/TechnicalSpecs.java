package org.learningjava.mediadb.domain.model;

public record TechnicalSpecs(
        Integer width,
        Integer height,
        Double durationSeconds,
        long fileSizeBytes,
        String format
) {
}
