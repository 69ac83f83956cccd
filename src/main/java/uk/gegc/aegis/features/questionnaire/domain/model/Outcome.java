package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Regulated screening outcome. Only {@link #ELIGIBLE} allows a verification code to be issued.
 */
public enum Outcome {
    @JsonProperty("eligible")
    ELIGIBLE,
    @JsonProperty("consult_professional")
    CONSULT_PROFESSIONAL,
    @JsonProperty("ineligible")
    INELIGIBLE
}
