package uk.gegc.aegis.features.audit.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import uk.gegc.aegis.features.audit.domain.model.AuditLog;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

public interface AuditLogRepository extends Repository<AuditLog, UUID> {

    AuditLog save(AuditLog log);

    @Query(value = """
            SELECT a FROM AuditLog a
            WHERE a.tenantId = :#{#tenant.tenantId}
              AND (:entityId IS NULL OR a.entityId = :entityId)
            ORDER BY a.createdAt DESC
            """,
            countQuery = """
            SELECT COUNT(a) FROM AuditLog a
            WHERE a.tenantId = :#{#tenant.tenantId}
              AND (:entityId IS NULL OR a.entityId = :entityId)
            """)
    Page<AuditLog> findForTenant(@Param("tenant") TenantContext tenant,
                                 @Param("entityId") UUID entityId,
                                 Pageable pageable);
}
