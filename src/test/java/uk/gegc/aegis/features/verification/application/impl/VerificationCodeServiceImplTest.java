package uk.gegc.aegis.features.verification.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.util.ReflectionTestUtils;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.screening.api.dto.SessionStatusDto;
import uk.gegc.aegis.features.screening.application.ScreeningSessionService;
import uk.gegc.aegis.features.screening.domain.model.ScreeningPath;
import uk.gegc.aegis.features.screening.domain.model.SessionStatus;
import uk.gegc.aegis.features.verification.api.dto.CodeCheckResponse;
import uk.gegc.aegis.features.verification.application.IssuedCode;
import uk.gegc.aegis.features.verification.application.RedemptionResult;
import uk.gegc.aegis.features.verification.application.VerificationMetrics;
import uk.gegc.aegis.features.verification.config.VerificationProperties;
import uk.gegc.aegis.features.verification.domain.exception.CodeGenerationExhaustedException;
import uk.gegc.aegis.features.verification.domain.exception.InvalidCodeFormatException;
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
import uk.gegc.aegis.testsupport.TestTenants;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationCodeServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");
    private static final String CODE = "AEGIS-7KQ2-M9XH-3PDA";
    private static final String MASKED = "AEGIS-****-****-3PDA";

    @Mock
    private VerificationCodeRepository codeRepository;
    @Mock
    private ScreeningSessionService screeningSessionService;
    @Mock
    private VerificationCodeGenerator codeGenerator;
    @Mock
    private AuditLogService auditLogService;
    @Captor
    private ArgumentCaptor<Map<String, Object>> detailsCaptor;

    private final TenantContext tenant = TestTenants.tenantA();
    private final UUID sessionId = UUID.randomUUID();
    private final UUID partnerId = UUID.randomUUID();

    private SimpleMeterRegistry meterRegistry;
    private VerificationCodeServiceImpl service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new VerificationCodeServiceImpl(codeRepository, screeningSessionService, codeGenerator,
                new VerificationProperties(), auditLogService, new VerificationMetrics(meterRegistry),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private VerificationCode code(CodeStatus status, Instant expiresAt) {
        VerificationCode code = VerificationCode.issue(tenant, sessionId, CODE, CodeType.POS_BARCODE, expiresAt,
                NOW.minus(Duration.ofHours(1)));
        ReflectionTestUtils.setField(code, "id", UUID.randomUUID());
        ReflectionTestUtils.setField(code, "status", status);
        if (status == CodeStatus.USED) {
            ReflectionTestUtils.setField(code, "usedAt", NOW.minusSeconds(30));
        }
        return code;
    }

    private SessionStatusDto eligibleSession() {
        return new SessionStatusDto(sessionId, UUID.randomUUID(), UUID.randomUUID(), SessionStatus.COMPLETED,
                ScreeningPath.MANUAL, Outcome.ELIGIBLE, NOW.minusSeconds(600), NOW.minusSeconds(300));
    }

    private void stubSaveAssigningId() {
        when(codeRepository.saveAndFlush(any(VerificationCode.class))).thenAnswer(inv -> {
            VerificationCode saved = inv.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });
    }

    @Nested
    class Issue {

        @ParameterizedTest
        @ValueSource(ints = {-1, 721})
        @DisplayName("issue: when the ttl is out of range then it throws before touching the session")
        void ttlOutOfRange(int ttl) {
            assertThatThrownBy(() -> service.issue(tenant, sessionId, CodeType.POS_BARCODE, ttl))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("720");

            verifyNoInteractions(screeningSessionService, codeRepository);
        }

        @Test
        @DisplayName("issue: when the session is not eligible then it throws and stores nothing")
        void notEligible() {
            when(screeningSessionService.isEligibleForCode(tenant, sessionId)).thenReturn(false);

            assertThatThrownBy(() -> service.issue(tenant, sessionId, CodeType.POS_BARCODE, null))
                    .isInstanceOf(NotEligibleException.class);

            verify(codeRepository, never()).saveAndFlush(any());
            verifyNoInteractions(auditLogService);
        }

        @Test
        @DisplayName("issue: when the session already has a code then that code is returned unchanged")
        void existingCodeReturned() {
            when(screeningSessionService.isEligibleForCode(tenant, sessionId)).thenReturn(true);
            when(codeRepository.findBySessionId(tenant, sessionId))
                    .thenReturn(Optional.of(code(CodeStatus.UNUSED, NOW.plus(Duration.ofHours(10)))));

            IssuedCode issued = service.issue(tenant, sessionId, CodeType.ECOMMERCE_JWT, 5);

            assertThat(issued.created()).isFalse();
            assertThat(issued.code().code()).isEqualTo(CODE);
            assertThat(issued.code().type()).isEqualTo(CodeType.POS_BARCODE);
            verifyNoInteractions(codeGenerator, auditLogService);
        }

        @Test
        @DisplayName("issue: when the first candidate collides then the next one is stored")
        void collisionThenSuccess() {
            when(screeningSessionService.isEligibleForCode(tenant, sessionId)).thenReturn(true);
            when(codeRepository.findBySessionId(tenant, sessionId)).thenReturn(Optional.empty());
            when(codeGenerator.generate()).thenReturn("AEGIS-AAAA-AAAA-AAAA", CODE);
            when(codeRepository.existsByCode("AEGIS-AAAA-AAAA-AAAA")).thenReturn(true);
            when(codeRepository.existsByCode(CODE)).thenReturn(false);
            stubSaveAssigningId();

            IssuedCode issued = service.issue(tenant, sessionId, null, null);

            assertThat(issued.created()).isTrue();
            assertThat(issued.code().code()).isEqualTo(CODE);
            assertThat(issued.code().type()).isEqualTo(CodeType.POS_BARCODE);
            assertThat(issued.code().status()).isEqualTo(CodeStatus.UNUSED);
            assertThat(issued.code().expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(72)));
            verify(auditLogService).record(eq(tenant), eq(AuditAction.CODE_ISSUED), eq("verification_code"),
                    any(UUID.class), eq("session:" + sessionId), detailsCaptor.capture());
            assertThat(detailsCaptor.getValue()).containsEntry("ttlHours", 72);
            assertThat(meterRegistry.counter("verification.codes.issued", "type", "pos_barcode").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("issue: when the ttl is zero then the code is already expired when returned")
        void zeroTtl() {
            when(screeningSessionService.isEligibleForCode(tenant, sessionId)).thenReturn(true);
            when(codeRepository.findBySessionId(tenant, sessionId)).thenReturn(Optional.empty());
            when(codeGenerator.generate()).thenReturn(CODE);
            when(codeRepository.existsByCode(CODE)).thenReturn(false);
            stubSaveAssigningId();

            IssuedCode issued = service.issue(tenant, sessionId, CodeType.POS_BARCODE, 0);

            assertThat(issued.code().expiresAt()).isEqualTo(NOW);
            assertThat(issued.code().status()).isEqualTo(CodeStatus.EXPIRED);
        }

        @Test
        @DisplayName("issue: when a concurrent request stored a code first then the winner is returned")
        void concurrentIssuanceReturnsWinner() {
            VerificationCode winner = code(CodeStatus.UNUSED, NOW.plus(Duration.ofHours(72)));
            when(screeningSessionService.isEligibleForCode(tenant, sessionId)).thenReturn(true);
            when(codeRepository.findBySessionId(tenant, sessionId))
                    .thenReturn(Optional.empty(), Optional.of(winner));
            when(codeGenerator.generate()).thenReturn("AEGIS-BBBB-BBBB-BBBB");
            when(codeRepository.existsByCode(anyString())).thenReturn(false);
            when(codeRepository.saveAndFlush(any(VerificationCode.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_verification_codes_session"));

            IssuedCode issued = service.issue(tenant, sessionId, CodeType.POS_BARCODE, null);

            assertThat(issued.created()).isFalse();
            assertThat(issued.code().code()).isEqualTo(CODE);
            verifyNoInteractions(auditLogService);
        }

        @Test
        @DisplayName("issue: when every candidate collides then it gives up after the configured attempts")
        void exhaustion() {
            when(screeningSessionService.isEligibleForCode(tenant, sessionId)).thenReturn(true);
            when(codeRepository.findBySessionId(tenant, sessionId)).thenReturn(Optional.empty());
            when(codeGenerator.generate()).thenReturn(CODE);
            when(codeRepository.existsByCode(CODE)).thenReturn(true);

            assertThatThrownBy(() -> service.issue(tenant, sessionId, CodeType.POS_BARCODE, null))
                    .isInstanceOf(CodeGenerationExhaustedException.class);

            verify(codeGenerator, times(5)).generate();
            verify(codeRepository, never()).saveAndFlush(any());
        }
    }

    @Nested
    class Redeem {

        @Test
        @DisplayName("redeem: when the conditional update consumes the code then the result carries the session")
        void success() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-1")).thenReturn(1);
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.USED, NOW.plus(Duration.ofHours(1)))));
            when(screeningSessionService.getSession(tenant, sessionId)).thenReturn(eligibleSession());

            RedemptionResult result = service.redeem(tenant, partnerId, CODE, "txn-1", Map.of("store", "42"));

            assertThat(result.valid()).isTrue();
            assertThat(result.failure()).isNull();
            assertThat(result.session().outcome()).isEqualTo(Outcome.ELIGIBLE);
            verify(auditLogService).record(eq(tenant), eq(AuditAction.CODE_VERIFIED), eq("verification_code"),
                    any(UUID.class), eq("partner:" + partnerId), detailsCaptor.capture());
            assertThat(detailsCaptor.getValue())
                    .containsEntry("code", MASKED)
                    .containsEntry("transactionId", "txn-1")
                    .containsEntry("metadata", Map.of("store", "42"));
            assertThat(meterRegistry.counter("verification.codes.redeemed").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("redeem: when no code exists in the tenant then it reports not_found and audits the attempt")
        void notFound() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-1")).thenReturn(0);
            when(codeRepository.findByCode(tenant, CODE)).thenReturn(Optional.empty());

            RedemptionResult result = service.redeem(tenant, partnerId, CODE, "txn-1", null);

            assertThat(result.valid()).isFalse();
            assertThat(result.failure()).isEqualTo(RedemptionFailure.NOT_FOUND);
            verify(auditLogService).record(eq(tenant), eq(AuditAction.CODE_VERIFICATION_FAILED),
                    eq("verification_code"), isNull(), eq("partner:" + partnerId), detailsCaptor.capture());
            assertThat(detailsCaptor.getValue())
                    .containsEntry("reason", "not_found")
                    .containsEntry("code", MASKED)
                    .doesNotContainKey("metadata");
            assertThat(meterRegistry.counter("verification.codes.redeem_failed", "reason", "not_found").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("verification.codes.redeemed").count()).isZero();
        }

        @Test
        @DisplayName("redeem: when the code was used then it reports already_used without retrying")
        void alreadyUsed() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-2")).thenReturn(0);
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.USED, NOW.plus(Duration.ofHours(1)))));

            RedemptionResult result = service.redeem(tenant, partnerId, CODE, "txn-2", null);

            assertThat(result.failure()).isEqualTo(RedemptionFailure.ALREADY_USED);
            verify(codeRepository, times(1)).redeemIfUnused(any(), anyString(), any(), any(), any());
        }

        @Test
        @DisplayName("redeem: when the code expires exactly now then it reports expired")
        void expiredAtBoundary() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-3")).thenReturn(0);
            when(codeRepository.findByCode(tenant, CODE)).thenReturn(Optional.of(code(CodeStatus.UNUSED, NOW)));

            RedemptionResult result = service.redeem(tenant, partnerId, CODE, "txn-3", null);

            assertThat(result.failure()).isEqualTo(RedemptionFailure.EXPIRED);
        }

        @Test
        @DisplayName("redeem: when the sweep already marked the code then it reports expired")
        void sweptCode() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-3")).thenReturn(0);
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.EXPIRED, NOW.minusSeconds(60))));

            assertThat(service.redeem(tenant, partnerId, CODE, "txn-3", null).failure())
                    .isEqualTo(RedemptionFailure.EXPIRED);
        }

        @Test
        @DisplayName("redeem: when the store times out once then the retry consumes the code")
        void transientFailureRetried() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-4"))
                    .thenThrow(new QueryTimeoutException("lock wait timeout"))
                    .thenReturn(1);
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.USED, NOW.plus(Duration.ofHours(1)))));
            when(screeningSessionService.getSession(tenant, sessionId)).thenReturn(eligibleSession());

            RedemptionResult result = service.redeem(tenant, partnerId, CODE, "txn-4", null);

            assertThat(result.valid()).isTrue();
            verify(codeRepository, times(2)).redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-4");
        }

        @Test
        @DisplayName("redeem: when the store times out on every attempt then the failure propagates and nothing is classified")
        void transientFailureOnEveryAttempt() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-7"))
                    .thenThrow(new QueryTimeoutException("lock wait timeout"));

            assertThatThrownBy(() -> service.redeem(tenant, partnerId, CODE, "txn-7", null))
                    .isInstanceOf(QueryTimeoutException.class)
                    .hasMessageContaining("lock wait timeout");

            verify(codeRepository, times(3)).redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-7");
            verify(codeRepository, never()).findByCode(any(), anyString());
            verifyNoInteractions(auditLogService);
            assertThat(meterRegistry.find("verification.codes.redeem_failed").counter()).isNull();
        }

        @Test
        @DisplayName("redeem: when the row keeps looking redeemable then attempts are bounded and it reports already_used")
        void retriesAreBounded() {
            when(codeRepository.redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-5")).thenReturn(0);
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.UNUSED, NOW.plus(Duration.ofHours(1)))));

            RedemptionResult result = service.redeem(tenant, partnerId, CODE, "txn-5", null);

            assertThat(result.failure()).isEqualTo(RedemptionFailure.ALREADY_USED);
            verify(codeRepository, times(3)).redeemIfUnused(tenant, CODE, NOW, partnerId, "txn-5");
        }

        @Test
        @DisplayName("redeem: when the code is malformed then nothing is looked up or audited")
        void malformed() {
            doThrow(new InvalidCodeFormatException("Verification code must look like AEGIS-XXXX-XXXX-XXXX"))
                    .when(codeGenerator).requireWellFormed("nope");

            assertThatThrownBy(() -> service.redeem(tenant, partnerId, "nope", "txn-6", null))
                    .isInstanceOf(InvalidCodeFormatException.class);

            verifyNoInteractions(codeRepository, auditLogService);
        }
    }

    @Nested
    class CheckAndExpire {

        @Test
        @DisplayName("checkOnly: when the code is unused then it is valid and nothing changes")
        void checkValid() {
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.UNUSED, NOW.plus(Duration.ofHours(2)))));

            CodeCheckResponse response = service.checkOnly(tenant, CODE);

            assertThat(response.status()).isEqualTo(CodeCheckStatus.VALID);
            assertThat(response.usedAt()).isNull();
            verify(codeRepository, never()).redeemIfUnused(any(), anyString(), any(), any(), any());
            verifyNoInteractions(auditLogService);
        }

        @Test
        @DisplayName("checkOnly: when the code is used or missing then the status says so")
        void checkUsedAndMissing() {
            when(codeRepository.findByCode(tenant, CODE))
                    .thenReturn(Optional.of(code(CodeStatus.USED, NOW.plus(Duration.ofHours(2)))));
            when(codeRepository.findByCode(tenant, "AEGIS-ZZZZ-ZZZZ-ZZZZ")).thenReturn(Optional.empty());

            assertThat(service.checkOnly(tenant, CODE).status()).isEqualTo(CodeCheckStatus.ALREADY_USED);
            assertThat(service.checkOnly(tenant, "AEGIS-ZZZZ-ZZZZ-ZZZZ").status()).isEqualTo(CodeCheckStatus.NOT_FOUND);
        }

        @Test
        @DisplayName("markExpired: when codes were expired then one audit entry records the count")
        void markExpiredAudits() {
            when(codeRepository.markExpired(tenant, NOW)).thenReturn(3);

            assertThat(service.markExpired(tenant, "system:expiry-sweep")).isEqualTo(3);

            verify(auditLogService).record(tenant, AuditAction.CODES_EXPIRED, "verification_code", null,
                    "system:expiry-sweep", Map.of("expiredCount", 3));
            assertThat(meterRegistry.counter("verification.codes.expired").count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("markExpired: when nothing expired then nothing is audited")
        void markExpiredNothing() {
            when(codeRepository.markExpired(tenant, NOW)).thenReturn(0);

            assertThat(service.markExpired(tenant, "system:expiry-sweep")).isZero();

            verifyNoInteractions(auditLogService);
        }
    }

    @Test
    @DisplayName("mask: when a code is logged then only the prefix and last group remain")
    void masking() {
        assertThat(VerificationCodeServiceImpl.mask(CODE)).isEqualTo(MASKED);
        assertThat(VerificationCodeServiceImpl.mask("short")).isEqualTo("****");
        assertThat(VerificationCodeServiceImpl.mask(null)).isNull();
    }
}
