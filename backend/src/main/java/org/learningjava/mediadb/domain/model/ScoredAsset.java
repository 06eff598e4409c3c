package org.learningjava.mediadb.domain.model;

/** An asset with its L2 distance to the query vector. Smaller is closer. */
public record ScoredAsset(MediaAsset asset, double distance) {
}
