package uk.gegc.aegis.features.partner.infra.security;

import uk.gegc.aegis.shared.security.TenantScopedPrincipal;

import java.util.UUID;

public record PartnerPrincipal(UUID partnerId, UUID tenantId, UUID apiKeyId) implements TenantScopedPrincipal {

    public static final String ROLE = "ROLE_PARTNER";
}
