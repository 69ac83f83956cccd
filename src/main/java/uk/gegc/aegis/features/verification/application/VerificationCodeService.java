package uk.gegc.aegis.features.verification.application;

import uk.gegc.aegis.features.verification.api.dto.CodeCheckResponse;
import uk.gegc.aegis.features.verification.domain.model.CodeType;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.Map;
import java.util.UUID;

public interface VerificationCodeService {

    /**
     * Issues the session's code, or returns the one it already has.
     *
     * @param ttlHours hours until expiry, {@code null} for the configured default
     */
    IssuedCode issue(TenantContext tenant, UUID sessionId, CodeType type, Integer ttlHours);

    /**
     * Consumes the code for a partner. Exactly one of any number of concurrent calls for the same
     * code succeeds.
     */
    RedemptionResult redeem(TenantContext tenant,
                            UUID partnerId,
                            String code,
                            String transactionId,
                            Map<String, Object> metadata);

    CodeCheckResponse checkOnly(TenantContext tenant, String code);

    /**
     * @return number of codes moved to expired
     */
    int markExpired(TenantContext tenant, String actor);
}
