package uk.gegc.aegis.features.questionnaire.domain.model;

/**
 * Hint describing where an answer could be sourced from a health record. Stored and echoed only.
 */
public record EhrMapping(
        String rule,
        String fhirPath,
        String displayName
) {
}
