package uk.gegc.aegis.features.questionnaire.infra.legacy;

import java.util.List;

/**
 * Ordered first-match rules with a fallback outcome, as exported by the old screener builder.
 * Accepted on import only; it is converted to a condition-bucket ruleset and never stored.
 */
public record LegacyLogic(
        List<LegacyRule> rules,
        LegacyOutcome defaultOutcome
) {
    public LegacyLogic {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
}
