package uk.gegc.aegis.features.partner.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Pharmacy, retailer or web shop that redeems verification codes at checkout.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "partners")
public class Partner {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Setter(AccessLevel.NONE)
    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private PartnerType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PartnerStatus status;

    @Setter(AccessLevel.NONE)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static Partner create(TenantContext tenant, String name, PartnerType type, Instant now) {
        Partner partner = new Partner();
        partner.tenantId = tenant.getTenantId();
        partner.name = name;
        partner.type = type;
        partner.status = PartnerStatus.ACTIVE;
        partner.createdAt = now;
        return partner;
    }
}
