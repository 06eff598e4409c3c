package org.learningjava.mediadb.domain.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Caller-provided metadata attached to an asset at ingestion time.
 */
public record IngestOptions(
        String source,
        String generationPrompt,
        String generationModel,
        Double generationTimeSeconds,
        Double generationCostUsd,
        String contentType,
        Set<String> subjects,
        Set<String> styleTags,
        Integer qualityRating,
        String qualityNotes,
        Set<Integer> episodes
) {
    public IngestOptions {
        subjects = Classification.copyOf(subjects);
        styleTags = Classification.copyOf(styleTags);
        episodes = episodes == null ? Set.of() : Set.copyOf(episodes);
        if (qualityRating != null) MediaAsset.requireValidRating(qualityRating);
        for (Integer e : episodes) MediaAsset.requireValidEpisode(e);
    }

    public static IngestOptions none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .source(source)
                .generationPrompt(generationPrompt)
                .generationModel(generationModel)
                .generationTimeSeconds(generationTimeSeconds)
                .generationCostUsd(generationCostUsd)
                .contentType(contentType)
                .subjects(subjects)
                .styleTags(styleTags)
                .qualityRating(qualityRating)
                .qualityNotes(qualityNotes)
                .episodes(episodes);
    }

    public Provenance provenance() {
        return new Provenance(source, generationPrompt, generationModel, generationTimeSeconds, generationCostUsd);
    }

    public Classification classification() {
        return new Classification(contentType, subjects, styleTags);
    }

    public static final class Builder {
        private String source;
        private String generationPrompt;
        private String generationModel;
        private Double generationTimeSeconds;
        private Double generationCostUsd;
        private String contentType;
        private final Set<String> subjects = new LinkedHashSet<>();
        private final Set<String> styleTags = new LinkedHashSet<>();
        private Integer qualityRating;
        private String qualityNotes;
        private final Set<Integer> episodes = new LinkedHashSet<>();

        public Builder source(String v) { this.source = v; return this; }
        public Builder generationPrompt(String v) { this.generationPrompt = v; return this; }
        public Builder generationModel(String v) { this.generationModel = v; return this; }
        public Builder generationTimeSeconds(Double v) { this.generationTimeSeconds = v; return this; }
        public Builder generationCostUsd(Double v) { this.generationCostUsd = v; return this; }
        public Builder contentType(String v) { this.contentType = v; return this; }
        public Builder qualityRating(Integer v) { this.qualityRating = v; return this; }
        public Builder qualityNotes(String v) { this.qualityNotes = v; return this; }

        public Builder subjects(Collection<String> v) {
            if (v != null) subjects.addAll(v);
            return this;
        }

        public Builder styleTags(Collection<String> v) {
            if (v != null) styleTags.addAll(v);
            return this;
        }

        public Builder episodes(Collection<Integer> v) {
            if (v != null) episodes.addAll(v);
            return this;
        }

        public IngestOptions build() {
            return new IngestOptions(source, generationPrompt, generationModel, generationTimeSeconds,
                    generationCostUsd, contentType, subjects, styleTags, qualityRating, qualityNotes, episodes);
        }
    }
}
