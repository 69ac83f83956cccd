package uk.gegc.aegis.features.partner.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.features.partner.api.dto.CreatePartnerRequest;
import uk.gegc.aegis.features.partner.api.dto.IssuedApiKeyDto;
import uk.gegc.aegis.features.partner.api.dto.PartnerDto;
import uk.gegc.aegis.features.partner.application.PartnerService;
import uk.gegc.aegis.features.partner.domain.model.Partner;
import uk.gegc.aegis.features.partner.domain.model.PartnerApiKey;
import uk.gegc.aegis.features.partner.domain.model.PartnerStatus;
import uk.gegc.aegis.features.partner.domain.repository.PartnerApiKeyRepository;
import uk.gegc.aegis.features.partner.domain.repository.PartnerRepository;
import uk.gegc.aegis.features.partner.infra.security.PartnerPrincipal;
import uk.gegc.aegis.shared.exception.ResourceNotFoundException;
import uk.gegc.aegis.shared.tenant.TenantContext;
import uk.gegc.aegis.shared.tenant.TenantContextGuard;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PartnerServiceImpl implements PartnerService {

    static final String KEY_MARKER = "ak_";
    static final int PREFIX_LENGTH = 12;
    private static final String PREFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SECRET_BYTES = 32;
    private static final int MAX_PREFIX_ATTEMPTS = 5;
    private static final Duration LAST_USED_RESOLUTION = Duration.ofMinutes(1);
    private static final SecureRandom RNG = new SecureRandom();

    private final PartnerRepository partnerRepository;
    private final PartnerApiKeyRepository apiKeyRepository;
    private final PasswordEncoder passwordEncoder;
    private final TenantContextGuard tenantContextGuard;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Override
    @Transactional
    public PartnerDto createPartner(TenantContext tenant, CreatePartnerRequest request, String actor) {
        Partner partner = partnerRepository.saveAndFlush(
                Partner.create(tenant, request.name(), request.type(), clock.instant()));
        log.info("Partner {} '{}' created by {}", partner.getId(), partner.getName(), actor);
        auditLogService.record(tenant, AuditAction.PARTNER_CREATED, "partner", partner.getId(), actor,
                Map.of("name", partner.getName(), "type", partner.getType()));
        return PartnerDto.from(partner);
    }

    @Override
    @Transactional
    public IssuedApiKeyDto issueApiKey(TenantContext tenant, UUID partnerId, Integer expiresInDays, String actor) {
        partnerRepository.findById(tenant, partnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Partner " + partnerId + " not found"));

        String prefix = uniquePrefix();
        String secret = randomSecret();
        String rawKey = KEY_MARKER + prefix + "_" + secret;

        Instant now = clock.instant();
        Instant expiresAt = expiresInDays == null ? null : now.plus(Duration.ofDays(expiresInDays));
        PartnerApiKey key = apiKeyRepository.saveAndFlush(PartnerApiKey.issue(
                tenant, partnerId, prefix, passwordEncoder.encode(rawKey), expiresAt, now));

        log.info("API key {} issued for partner {} by {}", prefix, partnerId, actor);
        auditLogService.record(tenant, AuditAction.API_KEY_ISSUED, "partner_api_key", key.getId(), actor,
                Map.of("partnerId", partnerId, "keyPrefix", prefix));
        return new IssuedApiKeyDto(key.getId(), partnerId, rawKey, prefix, expiresAt);
    }

    @Override
    public void revokeApiKey(TenantContext tenant, UUID partnerId, UUID keyId, String actor) {
        if (apiKeyRepository.revoke(tenant, partnerId, keyId) == 0) {
            throw new ResourceNotFoundException("API key " + keyId + " not found for partner " + partnerId);
        }
        log.info("API key {} of partner {} revoked by {}", keyId, partnerId, actor);
        auditLogService.record(tenant, AuditAction.API_KEY_REVOKED, "partner_api_key", keyId, actor,
                Map.of("partnerId", partnerId));
    }

    @Override
    public Optional<PartnerPrincipal> authenticate(String rawKey) {
        if (!isWellFormed(rawKey)) {
            return Optional.empty();
        }
        String prefix = rawKey.substring(KEY_MARKER.length(), KEY_MARKER.length() + PREFIX_LENGTH);

        Optional<PartnerApiKey> stored = apiKeyRepository.findByKeyPrefix(prefix);
        if (stored.isEmpty() || !passwordEncoder.matches(rawKey, stored.get().getHashedKey())) {
            log.debug("Rejected API key with prefix {}", prefix);
            return Optional.empty();
        }
        PartnerApiKey key = stored.get();
        Instant now = clock.instant();
        if (!key.isUsableAt(now)) {
            log.info("Rejected revoked or expired API key {}", prefix);
            return Optional.empty();
        }

        TenantContext tenant = tenantContextGuard.bind(key.getTenantId());
        boolean partnerActive = partnerRepository.findById(tenant, key.getPartnerId())
                .map(partner -> partner.getStatus() == PartnerStatus.ACTIVE)
                .orElse(false);
        if (!partnerActive) {
            log.info("Rejected API key {} of inactive partner {}", prefix, key.getPartnerId());
            return Optional.empty();
        }

        recordUse(tenant, key, now);
        return Optional.of(new PartnerPrincipal(key.getPartnerId(), key.getTenantId(), key.getId()));
    }

    private void recordUse(TenantContext tenant, PartnerApiKey key, Instant now) {
        try {
            apiKeyRepository.touchLastUsed(tenant, key.getId(), now, now.minus(LAST_USED_RESOLUTION));
        } catch (RuntimeException e) {
            log.warn("Could not record use of API key {}: {}", key.getKeyPrefix(), e.getMessage());
        }
    }

    private static boolean isWellFormed(String rawKey) {
        int separator = KEY_MARKER.length() + PREFIX_LENGTH;
        return rawKey != null
                && rawKey.startsWith(KEY_MARKER)
                && rawKey.length() > separator + 1
                && rawKey.charAt(separator) == '_';
    }

    private String uniquePrefix() {
        for (int attempt = 0; attempt < MAX_PREFIX_ATTEMPTS; attempt++) {
            StringBuilder prefix = new StringBuilder(PREFIX_LENGTH);
            for (int i = 0; i < PREFIX_LENGTH; i++) {
                prefix.append(PREFIX_ALPHABET.charAt(RNG.nextInt(PREFIX_ALPHABET.length())));
            }
            if (!apiKeyRepository.existsByKeyPrefix(prefix.toString())) {
                return prefix.toString();
            }
        }
        throw new IllegalStateException("Could not allocate a unique API key prefix");
    }

    private static String randomSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        RNG.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
