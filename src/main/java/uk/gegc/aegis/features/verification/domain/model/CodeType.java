package uk.gegc.aegis.features.verification.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CodeType {
    @JsonProperty("pos_barcode")
    POS_BARCODE,
    @JsonProperty("ecommerce_jwt")
    ECOMMERCE_JWT
}
