package uk.gegc.aegis.features.verification.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Single-use code issued for an eligible screening session.
 *
 * <p>Rows are inserted once and afterwards only change through the guarded updates in
 * {@code VerificationCodeRepository}.</p>
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "verification_codes")
public class VerificationCode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "session_id", nullable = false, updatable = false, unique = true)
    private UUID sessionId;

    @Column(name = "code", nullable = false, updatable = false, unique = true, length = 32)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 20)
    private CodeType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CodeStatus status;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "redeemed_by_partner_id")
    private UUID redeemedByPartnerId;

    @Column(name = "transaction_id", length = 100)
    private String transactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static VerificationCode issue(TenantContext tenant,
                                         UUID sessionId,
                                         String code,
                                         CodeType type,
                                         Instant expiresAt,
                                         Instant createdAt) {
        VerificationCode verificationCode = new VerificationCode();
        verificationCode.tenantId = tenant.getTenantId();
        verificationCode.sessionId = sessionId;
        verificationCode.code = code;
        verificationCode.type = type;
        verificationCode.status = CodeStatus.UNUSED;
        verificationCode.expiresAt = expiresAt;
        verificationCode.createdAt = createdAt;
        return verificationCode;
    }

    /**
     * Status as a caller at {@code now} should see it: an unused code past its expiry is expired
     * even before the sweep has run.
     */
    public CodeStatus effectiveStatus(Instant now) {
        if (status == CodeStatus.UNUSED && !expiresAt.isAfter(now)) {
            return CodeStatus.EXPIRED;
        }
        return status;
    }
}
