package uk.gegc.aegis.features.partner.domain.repository;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.partner.domain.model.PartnerApiKey;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface PartnerApiKeyRepository extends Repository<PartnerApiKey, UUID> {

    PartnerApiKey saveAndFlush(PartnerApiKey key);

    /**
     * Unscoped: the caller is not yet authenticated, and the tenant is taken from the matching row.
     */
    @Query("SELECT k FROM PartnerApiKey k WHERE k.keyPrefix = :prefix")
    Optional<PartnerApiKey> findByKeyPrefix(@Param("prefix") String prefix);

    @Query("SELECT CASE WHEN COUNT(k) > 0 THEN true ELSE false END FROM PartnerApiKey k WHERE k.keyPrefix = :prefix")
    boolean existsByKeyPrefix(@Param("prefix") String prefix);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE PartnerApiKey k
            SET k.status = uk.gegc.aegis.features.partner.domain.model.ApiKeyStatus.REVOKED
            WHERE k.id = :keyId
              AND k.partnerId = :partnerId
              AND k.tenantId = :#{#tenant.tenantId}
            """)
    int revoke(@Param("tenant") TenantContext tenant, @Param("partnerId") UUID partnerId, @Param("keyId") UUID keyId);

    /**
     * Records use at most once per interval so busy keys do not write on every request.
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE PartnerApiKey k
            SET k.lastUsedAt = :now
            WHERE k.id = :keyId
              AND k.tenantId = :#{#tenant.tenantId}
              AND (k.lastUsedAt IS NULL OR k.lastUsedAt < :staleBefore)
            """)
    int touchLastUsed(@Param("tenant") TenantContext tenant,
                      @Param("keyId") UUID keyId,
                      @Param("now") Instant now,
                      @Param("staleBefore") Instant staleBefore);
}
