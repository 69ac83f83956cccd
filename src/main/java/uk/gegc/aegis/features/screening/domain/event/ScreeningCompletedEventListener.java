package uk.gegc.aegis.features.screening.domain.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.shared.tenant.TenantContextGuard;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the audit entry for a completed screening once the completing transaction has committed,
 * so a rolled-back submission never leaves an entry behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScreeningCompletedEventListener {

    static final String ENTITY_TYPE = "screening_session";

    private final AuditLogService auditLogService;
    private final TenantContextGuard tenantContextGuard;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleScreeningCompleted(ScreeningCompletedEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("programId", event.getProgramId());
        details.put("questionnaireVersionId", event.getQuestionnaireVersionId());
        details.put("outcome", event.getOutcome());
        details.put("completedAt", event.getCompletedAt());

        auditLogService.record(
                tenantContextGuard.bind(event.getTenantId()),
                AuditAction.SESSION_COMPLETED,
                ENTITY_TYPE,
                event.getSessionId(),
                "session:" + event.getSessionId(),
                details
        );
        log.debug("Audited completion of session {}", event.getSessionId());
    }
}
