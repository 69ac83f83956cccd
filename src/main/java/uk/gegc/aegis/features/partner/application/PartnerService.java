package uk.gegc.aegis.features.partner.application;

import uk.gegc.aegis.features.partner.api.dto.CreatePartnerRequest;
import uk.gegc.aegis.features.partner.api.dto.IssuedApiKeyDto;
import uk.gegc.aegis.features.partner.api.dto.PartnerDto;
import uk.gegc.aegis.features.partner.infra.security.PartnerPrincipal;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.Optional;
import java.util.UUID;

public interface PartnerService {

    PartnerDto createPartner(TenantContext tenant, CreatePartnerRequest request, String actor);

    IssuedApiKeyDto issueApiKey(TenantContext tenant, UUID partnerId, Integer expiresInDays, String actor);

    void revokeApiKey(TenantContext tenant, UUID partnerId, UUID keyId, String actor);

    /**
     * Resolves a raw {@code ak_<prefix>_<secret>} key. Empty for anything that is not a live key of an
     * active partner.
     */
    Optional<PartnerPrincipal> authenticate(String rawKey);
}
