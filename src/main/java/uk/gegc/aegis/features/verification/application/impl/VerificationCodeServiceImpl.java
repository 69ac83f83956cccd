package uk.gegc.aegis.features.verification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.features.screening.api.dto.SessionStatusDto;
import uk.gegc.aegis.features.screening.application.ScreeningSessionService;
import uk.gegc.aegis.features.verification.api.dto.CodeCheckResponse;
import uk.gegc.aegis.features.verification.api.dto.VerificationCodeDto;
import uk.gegc.aegis.features.verification.application.IssuedCode;
import uk.gegc.aegis.features.verification.application.RedemptionResult;
import uk.gegc.aegis.features.verification.application.VerificationCodeService;
import uk.gegc.aegis.features.verification.application.VerificationMetrics;
import uk.gegc.aegis.features.verification.config.VerificationProperties;
import uk.gegc.aegis.features.verification.domain.exception.CodeGenerationExhaustedException;
import uk.gegc.aegis.features.verification.domain.exception.NotEligibleException;
import uk.gegc.aegis.features.verification.domain.model.CodeCheckStatus;
import uk.gegc.aegis.features.verification.domain.model.CodeStatus;
import uk.gegc.aegis.features.verification.domain.model.CodeType;
import uk.gegc.aegis.features.verification.domain.model.RedemptionFailure;
import uk.gegc.aegis.features.verification.domain.model.VerificationCode;
import uk.gegc.aegis.features.verification.domain.repository.VerificationCodeRepository;
import uk.gegc.aegis.features.verification.infra.VerificationCodeGenerator;
import uk.gegc.aegis.shared.exception.ValidationException;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issuance and redemption of verification codes.
 *
 * <p>None of these methods opens an outer transaction. Each repository call is its own unit, so
 * the conditional redeem statement commits on its own and a unique-key failure during issuance
 * does not poison a surrounding transaction.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationCodeServiceImpl implements VerificationCodeService {

    static final String ENTITY_TYPE = "verification_code";

    private final VerificationCodeRepository codeRepository;
    private final ScreeningSessionService screeningSessionService;
    private final VerificationCodeGenerator codeGenerator;
    private final VerificationProperties properties;
    private final AuditLogService auditLogService;
    private final VerificationMetrics metrics;
    private final Clock clock;

    @Override
    public IssuedCode issue(TenantContext tenant, UUID sessionId, CodeType type, Integer ttlHours) {
        int hours = resolveTtl(ttlHours);

        // throws SessionNotFoundException for an id outside the tenant
        screeningSessionService.getSession(tenant, sessionId);
        if (!screeningSessionService.isEligibleForCode(tenant, sessionId)) {
            throw new NotEligibleException(sessionId);
        }

        Optional<VerificationCode> existing = codeRepository.findBySessionId(tenant, sessionId);
        if (existing.isPresent()) {
            return new IssuedCode(VerificationCodeDto.from(existing.get(), clock.instant()), false);
        }

        CodeType codeType = type == null ? CodeType.POS_BARCODE : type;
        for (int attempt = 1; attempt <= properties.getMaxGenerationAttempts(); attempt++) {
            String candidate = codeGenerator.generate();
            if (codeRepository.existsByCode(candidate)) {
                log.warn("Verification code collision on attempt {} for session {}", attempt, sessionId);
                continue;
            }

            Instant now = clock.instant();
            try {
                VerificationCode saved = codeRepository.saveAndFlush(VerificationCode.issue(
                        tenant, sessionId, candidate, codeType, now.plus(Duration.ofHours(hours)), now));
                log.info("Issued verification code {} for session {}", mask(saved.getCode()), sessionId);
                metrics.recordIssued(codeType);
                auditLogService.record(tenant, AuditAction.CODE_ISSUED, ENTITY_TYPE, saved.getId(),
                        "session:" + sessionId, Map.of("sessionId", sessionId, "type", codeType, "ttlHours", hours));
                return new IssuedCode(VerificationCodeDto.from(saved, now), true);
            } catch (DataIntegrityViolationException e) {
                Optional<VerificationCode> winner = codeRepository.findBySessionId(tenant, sessionId);
                if (winner.isPresent()) {
                    log.info("Concurrent issuance for session {} already stored a code", sessionId);
                    return new IssuedCode(VerificationCodeDto.from(winner.get(), clock.instant()), false);
                }
                log.warn("Verification code insert collided on attempt {} for session {}", attempt, sessionId);
            }
        }
        log.error("Gave up generating a verification code for session {} after {} attempts",
                sessionId, properties.getMaxGenerationAttempts());
        throw new CodeGenerationExhaustedException(properties.getMaxGenerationAttempts());
    }

    @Override
    public RedemptionResult redeem(TenantContext tenant,
                                   UUID partnerId,
                                   String code,
                                   String transactionId,
                                   Map<String, Object> metadata) {
        codeGenerator.requireWellFormed(code);
        int maxAttempts = Math.max(1, properties.getMaxRedeemAttempts());

        RedemptionFailure failure = null;
        TransientDataAccessException lastTransient = null;
        boolean lostRace = false;
        for (int attempt = 1; attempt <= maxAttempts && failure == null; attempt++) {
            Instant now = clock.instant();
            int updated;
            try {
                updated = codeRepository.redeemIfUnused(tenant, code, now, partnerId, transactionId);
            } catch (TransientDataAccessException e) {
                log.warn("Transient failure redeeming {} on attempt {}/{}: {}",
                        mask(code), attempt, maxAttempts, e.getMessage());
                lastTransient = e;
                continue;
            }

            if (updated == 1) {
                return redeemed(tenant, partnerId, code, transactionId, metadata);
            }

            // advisory only; the verdict above is already final
            failure = classify(codeRepository.findByCode(tenant, code), clock.instant());
            if (failure == null) {
                lostRace = true;
                log.debug("Code {} still looks redeemable after a lost race, retrying", mask(code));
            }
        }
        if (failure == null) {
            if (!lostRace) {
                // the store never answered, so the code's state is unknown
                log.error("Giving up redeeming {} after {} transient failures", mask(code), maxAttempts);
                throw lastTransient;
            }
            failure = RedemptionFailure.ALREADY_USED;
        }

        log.info("Partner {} failed to redeem {}: {}", partnerId, mask(code), failure.value());
        metrics.recordRedeemFailed(failure);
        Map<String, Object> details = attemptDetails(code, transactionId, metadata);
        details.put("reason", failure.value());
        auditLogService.record(tenant, AuditAction.CODE_VERIFICATION_FAILED, ENTITY_TYPE, null,
                "partner:" + partnerId, details);
        return RedemptionResult.failed(failure);
    }

    @Override
    public CodeCheckResponse checkOnly(TenantContext tenant, String code) {
        codeGenerator.requireWellFormed(code);
        Instant now = clock.instant();
        Optional<VerificationCode> found = codeRepository.findByCode(tenant, code);
        if (found.isEmpty()) {
            return new CodeCheckResponse(code, CodeCheckStatus.NOT_FOUND, null, null);
        }
        VerificationCode verificationCode = found.get();
        CodeCheckStatus status = switch (verificationCode.effectiveStatus(now)) {
            case UNUSED -> CodeCheckStatus.VALID;
            case USED -> CodeCheckStatus.ALREADY_USED;
            case EXPIRED -> CodeCheckStatus.EXPIRED;
        };
        return new CodeCheckResponse(code, status, verificationCode.getExpiresAt(), verificationCode.getUsedAt());
    }

    @Override
    public int markExpired(TenantContext tenant, String actor) {
        int expired = codeRepository.markExpired(tenant, clock.instant());
        if (expired > 0) {
            log.info("Expired {} verification codes for tenant {}", expired, tenant.getTenantId());
            metrics.recordExpired(expired);
            auditLogService.record(tenant, AuditAction.CODES_EXPIRED, ENTITY_TYPE, null, actor,
                    Map.of("expiredCount", expired));
        }
        return expired;
    }

    private RedemptionResult redeemed(TenantContext tenant,
                                      UUID partnerId,
                                      String code,
                                      String transactionId,
                                      Map<String, Object> metadata) {
        VerificationCode consumed = codeRepository.findByCode(tenant, code)
                .orElseThrow(() -> new IllegalStateException("Redeemed code " + mask(code) + " vanished"));
        SessionStatusDto session = screeningSessionService.getSession(tenant, consumed.getSessionId());

        log.info("Partner {} redeemed {} for session {}", partnerId, mask(code), consumed.getSessionId());
        metrics.recordRedeemed();
        auditLogService.record(tenant, AuditAction.CODE_VERIFIED, ENTITY_TYPE, consumed.getId(),
                "partner:" + partnerId, attemptDetails(code, transactionId, metadata));
        return RedemptionResult.success(consumed, session);
    }

    /**
     * Explains a 0-row redeem. Returns null when the row still looks redeemable, which means the
     * statement lost a race against a transaction that has since rolled back.
     */
    private static RedemptionFailure classify(Optional<VerificationCode> found, Instant now) {
        if (found.isEmpty()) {
            return RedemptionFailure.NOT_FOUND;
        }
        VerificationCode code = found.get();
        if (code.getStatus() == CodeStatus.USED) {
            return RedemptionFailure.ALREADY_USED;
        }
        if (code.effectiveStatus(now) == CodeStatus.EXPIRED) {
            return RedemptionFailure.EXPIRED;
        }
        return null;
    }

    private int resolveTtl(Integer ttlHours) {
        if (ttlHours == null) {
            return properties.getDefaultTtlHours();
        }
        if (ttlHours < 0 || ttlHours > properties.getMaxTtlHours()) {
            throw new ValidationException("expiresInHours must be between 0 and " + properties.getMaxTtlHours());
        }
        return ttlHours;
    }

    private static Map<String, Object> attemptDetails(String code, String transactionId, Map<String, Object> metadata) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", mask(code));
        details.put("transactionId", transactionId);
        if (metadata != null && !metadata.isEmpty()) {
            details.put("metadata", metadata);
        }
        return details;
    }

    /**
     * Keeps the prefix and the last group so support can correlate without exposing a live code.
     */
    static String mask(String code) {
        if (code == null) {
            return null;
        }
        String[] groups = code.split("-", -1);
        if (groups.length < 3) {
            return "****";
        }
        for (int i = 1; i < groups.length - 1; i++) {
            groups[i] = "****";
        }
        return String.join("-", groups);
    }
}
