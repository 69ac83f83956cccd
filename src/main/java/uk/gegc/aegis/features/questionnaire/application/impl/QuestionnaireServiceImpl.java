package uk.gegc.aegis.features.questionnaire.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.features.program.domain.model.DrugProgram;
import uk.gegc.aegis.features.program.domain.repository.DrugProgramRepository;
import uk.gegc.aegis.features.questionnaire.api.dto.CreateQuestionnaireVersionRequest;
import uk.gegc.aegis.features.questionnaire.api.dto.QuestionnaireVersionDto;
import uk.gegc.aegis.features.questionnaire.application.QuestionnaireService;
import uk.gegc.aegis.features.questionnaire.application.RulesetValidator;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireVersion;
import uk.gegc.aegis.features.questionnaire.domain.model.Ruleset;
import uk.gegc.aegis.features.questionnaire.domain.repository.QuestionnaireVersionRepository;
import uk.gegc.aegis.features.questionnaire.infra.legacy.LegacyRulesetMigrator;
import uk.gegc.aegis.shared.exception.DuplicateResourceException;
import uk.gegc.aegis.shared.exception.ResourceNotFoundException;
import uk.gegc.aegis.shared.exception.ValidationException;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionnaireServiceImpl implements QuestionnaireService {

    private static final String ENTITY_TYPE = "questionnaire_version";

    private final QuestionnaireVersionRepository versionRepository;
    private final DrugProgramRepository programRepository;
    private final RulesetValidator rulesetValidator;
    private final LegacyRulesetMigrator legacyRulesetMigrator;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Override
    @Transactional
    public QuestionnaireVersionDto createVersion(TenantContext tenant,
                                                 UUID programId,
                                                 CreateQuestionnaireVersionRequest request,
                                                 String actor) {
        loadProgram(tenant, programId);

        if (request.ruleset() != null && request.legacyLogic() != null) {
            throw new ValidationException("Supply either ruleset or legacyLogic, not both");
        }
        if (request.ruleset() == null && request.legacyLogic() == null) {
            throw new ValidationException("A ruleset is required");
        }
        Ruleset ruleset = request.ruleset() != null
                ? request.ruleset()
                : legacyRulesetMigrator.migrate(request.legacyLogic(), request.questions());

        QuestionnaireDefinition definition = new QuestionnaireDefinition(
                request.title(),
                request.description(),
                request.questions(),
                ruleset,
                request.disclaimers()
        );
        rulesetValidator.validate(definition);

        int versionNumber = versionRepository.findMaxVersionNumber(tenant, programId) + 1;
        QuestionnaireVersion saved;
        try {
            saved = versionRepository.saveAndFlush(QuestionnaireVersion.create(
                    tenant, programId, versionNumber, definition, request.notes(), actor, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException(
                    "Version " + versionNumber + " of program " + programId + " was created concurrently; retry");
        }

        log.info("Created questionnaire version {} (v{}) for program {}", saved.getId(), versionNumber, programId);
        auditLogService.record(tenant, AuditAction.QUESTIONNAIRE_VERSION_CREATED, ENTITY_TYPE, saved.getId(), actor,
                Map.of("programId", programId.toString(), "versionNumber", versionNumber,
                        "legacyImport", request.legacyLogic() != null));
        return QuestionnaireVersionDto.from(saved, false);
    }

    @Override
    @Transactional
    public QuestionnaireVersionDto publish(TenantContext tenant, UUID programId, UUID versionId, String actor) {
        DrugProgram program = loadProgram(tenant, programId);
        QuestionnaireVersion version = versionRepository.findById(tenant, versionId)
                .filter(v -> v.getProgramId().equals(programId))
                .orElseThrow(() -> new ResourceNotFoundException("Questionnaire version " + versionId + " not found"));

        rulesetValidator.validate(version.getDefinition());

        UUID previous = program.getActiveQuestionnaireVersionId();
        programRepository.activateVersion(tenant, programId, versionId, clock.instant());

        log.info("Published questionnaire version {} (v{}) for program {}", versionId, version.getVersionNumber(), programId);
        auditLogService.record(tenant, AuditAction.QUESTIONNAIRE_VERSION_PUBLISHED, ENTITY_TYPE, versionId, actor,
                Map.of("programId", programId.toString(),
                        "versionNumber", version.getVersionNumber(),
                        "previousVersionId", Objects.toString(previous, "none")));
        return QuestionnaireVersionDto.from(version, true);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuestionnaireVersionDto> listVersions(TenantContext tenant, UUID programId) {
        DrugProgram program = loadProgram(tenant, programId);
        return versionRepository.findByProgram(tenant, programId).stream()
                .map(v -> QuestionnaireVersionDto.from(v, v.getId().equals(program.getActiveQuestionnaireVersionId())))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionnaireVersionDto getVersion(TenantContext tenant, UUID versionId) {
        QuestionnaireVersion version = versionRepository.findById(tenant, versionId)
                .orElseThrow(() -> new ResourceNotFoundException("Questionnaire version " + versionId + " not found"));
        boolean active = programRepository.findById(tenant, version.getProgramId())
                .map(p -> versionId.equals(p.getActiveQuestionnaireVersionId()))
                .orElse(false);
        return QuestionnaireVersionDto.from(version, active);
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionnaireVersion getActiveVersion(TenantContext tenant, UUID programId) {
        DrugProgram program = loadProgram(tenant, programId);
        if (program.getActiveQuestionnaireVersionId() == null) {
            throw new ResourceNotFoundException("Program " + programId + " has no published questionnaire");
        }
        return versionRepository.findById(tenant, program.getActiveQuestionnaireVersionId())
                .orElseThrow(() -> new ResourceNotFoundException("Questionnaire version "
                        + program.getActiveQuestionnaireVersionId() + " not found"));
    }

    private DrugProgram loadProgram(TenantContext tenant, UUID programId) {
        return programRepository.findById(tenant, programId)
                .orElseThrow(() -> new ResourceNotFoundException("Program " + programId + " not found"));
    }
}
