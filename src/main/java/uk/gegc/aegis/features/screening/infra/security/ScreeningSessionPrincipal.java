package uk.gegc.aegis.features.screening.infra.security;

import uk.gegc.aegis.features.screening.domain.exception.SessionAccessDeniedException;
import uk.gegc.aegis.shared.security.TenantScopedPrincipal;

import java.util.UUID;

/**
 * Caller holding a session token. May only act on {@link #sessionId()}.
 */
public record ScreeningSessionPrincipal(UUID sessionId, UUID tenantId) implements TenantScopedPrincipal {

    public static final String ROLE = "ROLE_SCREENING_SESSION";

    public static void requireSession(ScreeningSessionPrincipal principal, UUID sessionId) {
        if (principal == null || !principal.sessionId().equals(sessionId)) {
            throw new SessionAccessDeniedException("Session token does not grant access to session " + sessionId);
        }
    }
}
