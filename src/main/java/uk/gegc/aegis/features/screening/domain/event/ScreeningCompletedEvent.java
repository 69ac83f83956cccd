package uk.gegc.aegis.features.screening.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a screening session reaches {@code COMPLETED}. Listeners run after the completing
 * transaction commits.
 */
public class ScreeningCompletedEvent extends ApplicationEvent {

    private final UUID tenantId;
    private final UUID sessionId;
    private final UUID programId;
    private final UUID questionnaireVersionId;
    private final Outcome outcome;
    private final Instant completedAt;

    public ScreeningCompletedEvent(Object source,
                                   UUID tenantId,
                                   UUID sessionId,
                                   UUID programId,
                                   UUID questionnaireVersionId,
                                   Outcome outcome,
                                   Instant completedAt) {
        super(source);
        this.tenantId = tenantId;
        this.sessionId = sessionId;
        this.programId = programId;
        this.questionnaireVersionId = questionnaireVersionId;
        this.outcome = outcome;
        this.completedAt = completedAt;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getProgramId() {
        return programId;
    }

    public UUID getQuestionnaireVersionId() {
        return questionnaireVersionId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
