package uk.gegc.aegis.features.screening.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

/**
 * One patient's pass through a questionnaire version.
 *
 * <p>Answers, outcome, status and completion time are written together, once, by
 * {@code ScreeningSessionRepository#completeIfStarted}. The entity exposes no setters for them.</p>
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "screening_sessions")
public class ScreeningSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "program_id", nullable = false, updatable = false)
    private UUID programId;

    @Column(name = "questionnaire_version_id", nullable = false, updatable = false)
    private UUID questionnaireVersionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "path", nullable = false, updatable = false, length = 20)
    private ScreeningPath path;

    @Column(name = "answers", nullable = false, columnDefinition = "LONGTEXT")
    private String answers;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 30)
    private Outcome outcome;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public static ScreeningSession start(TenantContext tenant,
                                         UUID programId,
                                         UUID questionnaireVersionId,
                                         ScreeningPath path,
                                         Instant startedAt) {
        ScreeningSession session = new ScreeningSession();
        session.tenantId = tenant.getTenantId();
        session.programId = programId;
        session.questionnaireVersionId = questionnaireVersionId;
        session.status = SessionStatus.STARTED;
        session.path = path;
        session.answers = "{}";
        session.startedAt = startedAt;
        return session;
    }
}
