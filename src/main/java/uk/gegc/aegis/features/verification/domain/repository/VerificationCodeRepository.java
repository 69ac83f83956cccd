package uk.gegc.aegis.features.verification.domain.repository;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.verification.domain.model.VerificationCode;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface VerificationCodeRepository extends Repository<VerificationCode, UUID> {

    VerificationCode saveAndFlush(VerificationCode code);

    /**
     * Collision probe against the global unique index on {@code code}. Returns no row data.
     */
    @Query("SELECT CASE WHEN COUNT(c) > 0 THEN true ELSE false END FROM VerificationCode c WHERE c.code = :code")
    boolean existsByCode(@Param("code") String code);

    @Query("SELECT c FROM VerificationCode c WHERE c.sessionId = :sessionId AND c.tenantId = :#{#tenant.tenantId}")
    Optional<VerificationCode> findBySessionId(@Param("tenant") TenantContext tenant, @Param("sessionId") UUID sessionId);

    @Query("SELECT c FROM VerificationCode c WHERE c.code = :code AND c.tenantId = :#{#tenant.tenantId}")
    Optional<VerificationCode> findByCode(@Param("tenant") TenantContext tenant, @Param("code") String code);

    /**
     * Consumes an unused, unexpired code in one conditional statement. The affected row count
     * (0 or 1) is the redemption verdict.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE VerificationCode c
            SET c.status = uk.gegc.aegis.features.verification.domain.model.CodeStatus.USED,
                c.usedAt = :now,
                c.redeemedByPartnerId = :partnerId,
                c.transactionId = :transactionId
            WHERE c.code = :code
              AND c.tenantId = :#{#tenant.tenantId}
              AND c.status = uk.gegc.aegis.features.verification.domain.model.CodeStatus.UNUSED
              AND c.expiresAt > :now
            """)
    int redeemIfUnused(@Param("tenant") TenantContext tenant,
                       @Param("code") String code,
                       @Param("now") Instant now,
                       @Param("partnerId") UUID partnerId,
                       @Param("transactionId") String transactionId);

    /**
     * Moves unused codes at or past expiry to {@code EXPIRED}. Never matches a row
     * {@link #redeemIfUnused} can match at the same instant.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE VerificationCode c
            SET c.status = uk.gegc.aegis.features.verification.domain.model.CodeStatus.EXPIRED
            WHERE c.tenantId = :#{#tenant.tenantId}
              AND c.status = uk.gegc.aegis.features.verification.domain.model.CodeStatus.UNUSED
              AND c.expiresAt <= :now
            """)
    int markExpired(@Param("tenant") TenantContext tenant, @Param("now") Instant now);

    @Query("""
            SELECT DISTINCT c.tenantId FROM VerificationCode c
            WHERE c.status = uk.gegc.aegis.features.verification.domain.model.CodeStatus.UNUSED
              AND c.expiresAt <= :now
            """)
    List<UUID> findTenantsWithExpirableCodes(@Param("now") Instant now);
}
