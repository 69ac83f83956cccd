package uk.gegc.aegis.features.partner.domain.model;

public enum PartnerStatus {
    ACTIVE,
    SUSPENDED
}
