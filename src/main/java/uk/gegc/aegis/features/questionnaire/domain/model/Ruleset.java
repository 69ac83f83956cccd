package uk.gegc.aegis.features.questionnaire.domain.model;

import java.util.List;

/**
 * Condition-bucket ruleset. Buckets under one outcome are alternatives: the outcome applies when
 * any of its buckets matches. Ineligible buckets are always checked before eligible ones.
 */
public record Ruleset(
        List<OutcomeBucket> ineligible,
        List<OutcomeBucket> eligible
) {
    public Ruleset {
        ineligible = ineligible == null ? List.of() : List.copyOf(ineligible);
        eligible = eligible == null ? List.of() : List.copyOf(eligible);
    }
}
