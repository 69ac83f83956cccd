package uk.gegc.aegis.features.screening.domain.model;

/**
 * {@code STARTED -> COMPLETED}. There is no other transition; an unfinished session stays started.
 */
public enum SessionStatus {
    STARTED,
    COMPLETED
}
