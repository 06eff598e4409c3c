package org.learningjava.mediadb.domain.model;

public record Provenance(
        String source,              // e.g. midjourney, gemini, press_kit, wan26_api
        String generationPrompt,
        String generationModel,
        Double generationTimeSeconds,
        Double generationCostUsd
) {
    public static Provenance ofSource(String source) {
        return new Provenance(source, null, null, null, null);
    }
}
