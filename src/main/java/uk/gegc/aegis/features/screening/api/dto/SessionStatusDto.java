package uk.gegc.aegis.features.screening.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.screening.domain.model.ScreeningPath;
import uk.gegc.aegis.features.screening.domain.model.ScreeningSession;
import uk.gegc.aegis.features.screening.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SessionStatusDto")
public record SessionStatusDto(
        UUID id,
        UUID programId,
        UUID questionnaireVersionId,
        SessionStatus status,
        ScreeningPath path,
        Outcome outcome,
        Instant startedAt,
        Instant completedAt
) {
    public static SessionStatusDto from(ScreeningSession session) {
        return new SessionStatusDto(
                session.getId(),
                session.getProgramId(),
                session.getQuestionnaireVersionId(),
                session.getStatus(),
                session.getPath(),
                session.getOutcome(),
                session.getStartedAt(),
                session.getCompletedAt()
        );
    }
}
