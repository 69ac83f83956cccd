package uk.gegc.aegis.features.partner.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored form of a partner key. Only the lookup prefix and a hash of the full key are kept.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "partner_api_keys")
public class PartnerApiKey {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "partner_id", nullable = false, updatable = false)
    private UUID partnerId;

    @Column(name = "key_prefix", nullable = false, updatable = false, unique = true, length = 12)
    private String keyPrefix;

    @Column(name = "hashed_key", nullable = false, updatable = false, length = 100)
    private String hashedKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApiKeyStatus status;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static PartnerApiKey issue(TenantContext tenant,
                                      UUID partnerId,
                                      String keyPrefix,
                                      String hashedKey,
                                      Instant expiresAt,
                                      Instant now) {
        PartnerApiKey key = new PartnerApiKey();
        key.tenantId = tenant.getTenantId();
        key.partnerId = partnerId;
        key.keyPrefix = keyPrefix;
        key.hashedKey = hashedKey;
        key.status = ApiKeyStatus.ACTIVE;
        key.expiresAt = expiresAt;
        key.createdAt = now;
        return key;
    }

    public boolean isUsableAt(Instant now) {
        return status == ApiKeyStatus.ACTIVE && (expiresAt == null || expiresAt.isAfter(now));
    }
}
