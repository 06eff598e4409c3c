package org.learningjava.mediadb.domain.model;

public enum EpisodeUpdate {
    ADDED,
    ALREADY_PRESENT,
    NOT_FOUND
}
