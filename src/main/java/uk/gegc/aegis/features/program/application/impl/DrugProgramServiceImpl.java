package uk.gegc.aegis.features.program.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.features.audit.domain.model.AuditAction;
import uk.gegc.aegis.features.program.api.dto.CreateProgramRequest;
import uk.gegc.aegis.features.program.api.dto.DrugProgramDto;
import uk.gegc.aegis.features.program.api.dto.PublicProgramView;
import uk.gegc.aegis.features.program.application.DrugProgramService;
import uk.gegc.aegis.features.program.domain.model.DrugProgram;
import uk.gegc.aegis.features.program.domain.model.ProgramStatus;
import uk.gegc.aegis.features.program.domain.repository.DrugProgramRepository;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireVersion;
import uk.gegc.aegis.features.questionnaire.domain.repository.QuestionnaireVersionRepository;
import uk.gegc.aegis.shared.exception.DuplicateResourceException;
import uk.gegc.aegis.shared.exception.ResourceNotFoundException;
import uk.gegc.aegis.shared.exception.ValidationException;
import uk.gegc.aegis.shared.tenant.TenantContext;
import uk.gegc.aegis.shared.tenant.TenantContextGuard;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DrugProgramServiceImpl implements DrugProgramService {

    private static final String ENTITY_TYPE = "drug_program";

    private final DrugProgramRepository programRepository;
    private final QuestionnaireVersionRepository versionRepository;
    private final TenantContextGuard tenantContextGuard;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Override
    @Transactional
    public DrugProgramDto createProgram(TenantContext tenant, CreateProgramRequest request, String actor) {
        if (programRepository.existsBySlug(request.slug())) {
            throw new DuplicateResourceException("Slug '" + request.slug() + "' is already in use");
        }
        DrugProgram program = programRepository.saveAndFlush(
                DrugProgram.create(tenant, request.name(), request.brandName(), request.slug(), clock.instant()));
        log.info("Created drug program {} ({}) for tenant {}", program.getId(), program.getSlug(), tenant.getTenantId());
        auditLogService.record(tenant, AuditAction.PROGRAM_CREATED, ENTITY_TYPE, program.getId(), actor,
                Map.of("slug", program.getSlug()));
        return DrugProgramDto.from(program);
    }

    @Override
    @Transactional(readOnly = true)
    public DrugProgramDto getProgram(TenantContext tenant, UUID programId) {
        return DrugProgramDto.from(loadProgram(tenant, programId));
    }

    @Override
    @Transactional
    public DrugProgramDto updateStatus(TenantContext tenant, UUID programId, ProgramStatus status, String actor) {
        DrugProgram program = loadProgram(tenant, programId);
        ProgramStatus previous = program.getStatus();
        if (status == ProgramStatus.ACTIVE && program.getActiveQuestionnaireVersionId() == null) {
            throw new ValidationException("Program " + programId + " cannot be activated before a questionnaire version is published");
        }
        program.setStatus(status);
        program.setUpdatedAt(clock.instant());
        programRepository.saveAndFlush(program);
        auditLogService.record(tenant, AuditAction.PROGRAM_STATUS_CHANGED, ENTITY_TYPE, programId, actor,
                Map.of("from", previous.name(), "to", status.name()));
        return DrugProgramDto.from(program);
    }

    @Override
    @Transactional(readOnly = true)
    public PublicProgramView getPublicProgram(String slug) {
        DrugProgram program = programRepository.findBySlug(slug)
                .filter(p -> p.getStatus() == ProgramStatus.ACTIVE)
                .filter(p -> p.getActiveQuestionnaireVersionId() != null)
                .orElseThrow(() -> new ResourceNotFoundException("Program '" + slug + "' not found"));

        TenantContext tenant = tenantContextGuard.bind(program.getTenantId());
        QuestionnaireVersion version = versionRepository.findById(tenant, program.getActiveQuestionnaireVersionId())
                .orElseThrow(() -> new ResourceNotFoundException("Program '" + slug + "' has no published questionnaire"));
        QuestionnaireDefinition definition = version.getDefinition();

        return new PublicProgramView(
                program.getSlug(),
                program.getName(),
                program.getBrandName(),
                version.getId(),
                definition.title(),
                definition.description(),
                definition.questions(),
                definition.disclaimers()
        );
    }

    private DrugProgram loadProgram(TenantContext tenant, UUID programId) {
        return programRepository.findById(tenant, programId)
                .orElseThrow(() -> new ResourceNotFoundException("Program " + programId + " not found"));
    }
}
