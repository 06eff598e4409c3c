package org.learningjava.mediadb.domain.model;

/**
 * Attribute predicate over assets. Every field is optional; a null field does not restrict.
 * A row whose attribute is absent never matches a set field (e.g. unrated assets fail {@code minQuality}).
 */
public record AssetFilter(
        MediaType mediaType,
        Integer minQuality,
        String subject,
        Integer episode,
        Integer excludeEpisode,
        String source
) {
    public static AssetFilter none() {
        return new AssetFilter(null, null, null, null, null, null);
    }

    public AssetFilter withMediaType(MediaType type) {
        return new AssetFilter(type, minQuality, subject, episode, excludeEpisode, source);
    }

    public AssetFilter withMinQuality(Integer min) {
        return new AssetFilter(mediaType, min, subject, episode, excludeEpisode, source);
    }

    public AssetFilter withSubject(String s) {
        return new AssetFilter(mediaType, minQuality, s, episode, excludeEpisode, source);
    }

    public AssetFilter withEpisode(Integer e) {
        return new AssetFilter(mediaType, minQuality, subject, e, excludeEpisode, source);
    }

    public AssetFilter withoutEpisode(Integer e) {
        return new AssetFilter(mediaType, minQuality, subject, episode, e, source);
    }

    public AssetFilter withSource(String s) {
        return new AssetFilter(mediaType, minQuality, subject, episode, excludeEpisode, s);
    }
}
