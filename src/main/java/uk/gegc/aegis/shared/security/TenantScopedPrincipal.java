package uk.gegc.aegis.shared.security;

import java.util.UUID;

/**
 * Principal whose credential already pins the caller to one tenant.
 */
public interface TenantScopedPrincipal {

    UUID tenantId();
}
