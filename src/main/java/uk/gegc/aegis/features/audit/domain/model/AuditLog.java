package uk.gegc.aegis.features.audit.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "audit_logs")
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "action", nullable = false, length = 60)
    private String action;

    @Column(name = "entity_type", nullable = false, length = 60)
    private String entityType;

    @Column(name = "entity_id")
    private UUID entityId;

    @Column(name = "actor", nullable = false, length = 100)
    private String actor;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static AuditLog create(TenantContext tenant,
                                  AuditAction action,
                                  String entityType,
                                  UUID entityId,
                                  String actor,
                                  String details,
                                  Instant createdAt) {
        AuditLog log = new AuditLog();
        log.tenantId = tenant.getTenantId();
        log.action = action.value();
        log.entityType = entityType;
        log.entityId = entityId;
        log.actor = actor;
        log.details = details;
        log.createdAt = createdAt;
        return log;
    }
}
