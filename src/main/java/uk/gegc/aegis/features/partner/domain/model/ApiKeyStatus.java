package uk.gegc.aegis.features.partner.domain.model;

public enum ApiKeyStatus {
    ACTIVE,
    REVOKED
}
