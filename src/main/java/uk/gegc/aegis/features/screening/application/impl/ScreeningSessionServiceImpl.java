package uk.gegc.aegis.features.screening.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.program.domain.model.DrugProgram;
import uk.gegc.aegis.features.program.domain.model.ProgramStatus;
import uk.gegc.aegis.features.program.domain.repository.DrugProgramRepository;
import uk.gegc.aegis.features.questionnaire.application.EvaluationEngine;
import uk.gegc.aegis.features.questionnaire.application.EvaluationResult;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireVersion;
import uk.gegc.aegis.features.questionnaire.domain.repository.QuestionnaireVersionRepository;
import uk.gegc.aegis.features.screening.api.dto.SessionStatusDto;
import uk.gegc.aegis.features.screening.api.dto.StartSessionResponse;
import uk.gegc.aegis.features.screening.api.dto.SubmitAnswersResponse;
import uk.gegc.aegis.features.screening.application.ScreeningSessionService;
import uk.gegc.aegis.features.screening.domain.event.ScreeningCompletedEvent;
import uk.gegc.aegis.features.screening.domain.exception.SessionAlreadyCompletedException;
import uk.gegc.aegis.features.screening.domain.exception.SessionNotFoundException;
import uk.gegc.aegis.features.screening.domain.model.ScreeningPath;
import uk.gegc.aegis.features.screening.domain.model.ScreeningSession;
import uk.gegc.aegis.features.screening.domain.model.SessionStatus;
import uk.gegc.aegis.features.screening.domain.repository.ScreeningSessionRepository;
import uk.gegc.aegis.features.screening.infra.security.SessionTokenService;
import uk.gegc.aegis.shared.exception.ResourceNotFoundException;
import uk.gegc.aegis.shared.tenant.TenantContext;
import uk.gegc.aegis.shared.tenant.TenantContextGuard;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningSessionServiceImpl implements ScreeningSessionService {

    private final ScreeningSessionRepository sessionRepository;
    private final QuestionnaireVersionRepository versionRepository;
    private final DrugProgramRepository programRepository;
    private final EvaluationEngine evaluationEngine;
    private final SessionTokenService sessionTokenService;
    private final TenantContextGuard tenantContextGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public UUID create(TenantContext tenant, UUID programId, UUID questionnaireVersionId, ScreeningPath path) {
        QuestionnaireVersion version = versionRepository.findById(tenant, questionnaireVersionId)
                .filter(v -> v.getProgramId().equals(programId))
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Questionnaire version " + questionnaireVersionId + " not found for program " + programId));

        ScreeningSession session = sessionRepository.saveAndFlush(ScreeningSession.start(
                tenant, programId, version.getId(), path == null ? ScreeningPath.MANUAL : path, clock.instant()));
        log.info("Started screening session {} on program {} version {}", session.getId(), programId, version.getVersionNumber());
        return session.getId();
    }

    @Override
    @Transactional
    public StartSessionResponse start(String programSlug, ScreeningPath path) {
        DrugProgram program = programRepository.findBySlug(programSlug)
                .filter(p -> p.getStatus() == ProgramStatus.ACTIVE)
                .filter(p -> p.getActiveQuestionnaireVersionId() != null)
                .orElseThrow(() -> new ResourceNotFoundException("Program '" + programSlug + "' not found"));
        TenantContext tenant = tenantContextGuard.bind(program.getTenantId());

        UUID versionId = program.getActiveQuestionnaireVersionId();
        UUID sessionId = create(tenant, program.getId(), versionId, path);
        SessionTokenService.IssuedSessionToken token = sessionTokenService.issue(sessionId, tenant.getTenantId());
        return new StartSessionResponse(sessionId, token.token(), token.expiresAt(), versionId);
    }

    @Override
    @Transactional
    public SubmitAnswersResponse submitAnswers(TenantContext tenant, UUID sessionId, Map<String, JsonNode> answers) {
        ScreeningSession session = sessionRepository.findById(tenant, sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (session.getStatus() == SessionStatus.COMPLETED) {
            throw new SessionAlreadyCompletedException(sessionId);
        }

        QuestionnaireVersion version = versionRepository.findById(tenant, session.getQuestionnaireVersionId())
                .orElseThrow(() -> new IllegalStateException(
                        "Session " + sessionId + " references missing questionnaire version " + session.getQuestionnaireVersionId()));

        EvaluationResult result = evaluationEngine.evaluate(version.getDefinition(), answers);

        Instant completedAt = clock.instant();
        int updated = sessionRepository.completeIfStarted(
                tenant, sessionId, serialize(result.normalizedAnswers()), result.outcome(), completedAt);
        if (updated == 0) {
            // a concurrent submission completed the session between our read and this update
            throw new SessionAlreadyCompletedException(sessionId);
        }

        log.info("Screening session {} completed with outcome {}", sessionId, result.outcome());
        eventPublisher.publishEvent(new ScreeningCompletedEvent(this, tenant.getTenantId(), sessionId,
                session.getProgramId(), session.getQuestionnaireVersionId(), result.outcome(), completedAt));
        return new SubmitAnswersResponse(sessionId, result.outcome(), completedAt, result.message());
    }

    @Override
    @Transactional(readOnly = true)
    public SessionStatusDto getSession(TenantContext tenant, UUID sessionId) {
        return sessionRepository.findById(tenant, sessionId)
                .map(SessionStatusDto::from)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isEligibleForCode(TenantContext tenant, UUID sessionId) {
        return sessionRepository.isEligibleForCode(tenant, sessionId);
    }

    private String serialize(Map<String, JsonNode> answers) {
        try {
            return objectMapper.writeValueAsString(answers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize answers", e);
        }
    }
}
