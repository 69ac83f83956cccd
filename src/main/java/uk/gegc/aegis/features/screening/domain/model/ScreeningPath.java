package uk.gegc.aegis.features.screening.domain.model;

/**
 * How the patient chose to answer: by hand, or with answers suggested from a health record.
 */
public enum ScreeningPath {
    MANUAL,
    EHR_ASSISTED,
    EHR_MANDATORY
}
