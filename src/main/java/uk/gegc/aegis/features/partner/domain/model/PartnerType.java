package uk.gegc.aegis.features.partner.domain.model;

public enum PartnerType {
    PHARMACY,
    RETAILER,
    ECOMMERCE,
    OTHER
}
