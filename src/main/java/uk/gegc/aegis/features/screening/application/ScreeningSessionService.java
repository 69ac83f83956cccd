package uk.gegc.aegis.features.screening.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.aegis.features.screening.api.dto.SessionStatusDto;
import uk.gegc.aegis.features.screening.api.dto.StartSessionResponse;
import uk.gegc.aegis.features.screening.api.dto.SubmitAnswersResponse;
import uk.gegc.aegis.features.screening.domain.model.ScreeningPath;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.Map;
import java.util.UUID;

public interface ScreeningSessionService {

    /**
     * Inserts a {@code STARTED} session with no answers, pinned to the given version.
     */
    UUID create(TenantContext tenant, UUID programId, UUID questionnaireVersionId, ScreeningPath path);

    default UUID create(TenantContext tenant, UUID programId, UUID questionnaireVersionId) {
        return create(tenant, programId, questionnaireVersionId, ScreeningPath.MANUAL);
    }

    /**
     * Starts a session on the active questionnaire of a public program and issues its session token.
     */
    StartSessionResponse start(String programSlug, ScreeningPath path);

    /**
     * Validates and evaluates the answers, then completes the session in one guarded update.
     * On a validation error the session is left untouched and the call may be retried.
     */
    SubmitAnswersResponse submitAnswers(TenantContext tenant, UUID sessionId, Map<String, JsonNode> answers);

    SessionStatusDto getSession(TenantContext tenant, UUID sessionId);

    /**
     * True iff the session is completed with an eligible outcome, read from the store at call time.
     */
    boolean isEligibleForCode(TenantContext tenant, UUID sessionId);
}
