package uk.gegc.aegis.features.audit.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.aegis.features.audit.api.dto.AuditLogDto;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.features.audit.domain.model.AuditLog;
import uk.gegc.aegis.features.audit.domain.repository.AuditLogRepository;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
public class AuditLogServiceImpl implements AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public AuditLogServiceImpl(AuditLogRepository auditLogRepository,
                               ObjectMapper objectMapper,
                               Clock clock,
                               PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void record(TenantContext tenant,
                       AuditAction action,
                       String entityType,
                       UUID entityId,
                       String actor,
                       Map<String, Object> details) {
        try {
            String serializedDetails = details == null || details.isEmpty()
                    ? null
                    : objectMapper.writeValueAsString(details);
            AuditLog entry = AuditLog.create(tenant, action, entityType, entityId, actor, serializedDetails, clock.instant());
            requiresNew.executeWithoutResult(status -> auditLogRepository.save(entry));
            log.debug("Audit logged: {} on {} {} by {}", action.value(), entityType, entityId, actor);
        } catch (Exception e) {
            log.error("Failed to record audit entry {} for {} {}: {}", action.value(), entityType, entityId, e.getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AuditLogDto> list(TenantContext tenant, UUID entityId, Pageable pageable) {
        return auditLogRepository.findForTenant(tenant, entityId, pageable).map(AuditLogDto::from);
    }
}
