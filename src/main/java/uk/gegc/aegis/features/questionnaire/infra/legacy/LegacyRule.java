package uk.gegc.aegis.features.questionnaire.infra.legacy;

public record LegacyRule(
        String condition,
        LegacyOutcome outcome,
        String message
) {
}
