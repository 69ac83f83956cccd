package uk.gegc.aegis.features.audit.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.aegis.features.audit.api.dto.AuditLogDto;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.Map;
import java.util.UUID;

public interface AuditLogService {

    /**
     * Records an entry in its own transaction. Failures are logged and never propagate to the caller.
     */
    void record(TenantContext tenant,
                AuditAction action,
                String entityType,
                UUID entityId,
                String actor,
                Map<String, Object> details);

    Page<AuditLogDto> list(TenantContext tenant, UUID entityId, Pageable pageable);
}
