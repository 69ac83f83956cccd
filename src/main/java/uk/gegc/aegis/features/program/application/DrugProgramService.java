package uk.gegc.aegis.features.program.application;

import uk.gegc.aegis.features.program.api.dto.CreateProgramRequest;
import uk.gegc.aegis.features.program.api.dto.DrugProgramDto;
import uk.gegc.aegis.features.program.api.dto.PublicProgramView;
import uk.gegc.aegis.features.program.domain.model.ProgramStatus;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

public interface DrugProgramService {

    DrugProgramDto createProgram(TenantContext tenant, CreateProgramRequest request, String actor);

    DrugProgramDto getProgram(TenantContext tenant, UUID programId);

    DrugProgramDto updateStatus(TenantContext tenant, UUID programId, ProgramStatus status, String actor);

    /**
     * Looks up an active program with a published questionnaire by its public slug.
     */
    PublicProgramView getPublicProgram(String slug);
}
