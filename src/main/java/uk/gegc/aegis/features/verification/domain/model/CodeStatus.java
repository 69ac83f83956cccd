package uk.gegc.aegis.features.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code UNUSED} moves to {@code USED} or {@code EXPIRED}. Both are terminal.
 */
public enum CodeStatus {
    @JsonProperty("unused")
    UNUSED,
    @JsonProperty("used")
    USED,
    @JsonProperty("expired")
    EXPIRED
}
