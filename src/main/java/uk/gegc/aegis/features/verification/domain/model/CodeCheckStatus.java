package uk.gegc.aegis.features.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CodeCheckStatus {
    @JsonProperty("valid")
    VALID,
    @JsonProperty("already_used")
    ALREADY_USED,
    @JsonProperty("expired")
    EXPIRED,
    @JsonProperty("not_found")
    NOT_FOUND
}
