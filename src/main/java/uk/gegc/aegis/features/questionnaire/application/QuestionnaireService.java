package uk.gegc.aegis.features.questionnaire.application;

import uk.gegc.aegis.features.questionnaire.api.dto.CreateQuestionnaireVersionRequest;
import uk.gegc.aegis.features.questionnaire.api.dto.QuestionnaireVersionDto;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireVersion;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.List;
import java.util.UUID;

public interface QuestionnaireService {

    /**
     * Stores a new immutable version numbered one above the program's current highest.
     */
    QuestionnaireVersionDto createVersion(TenantContext tenant, UUID programId, CreateQuestionnaireVersionRequest request, String actor);

    /**
     * Re-validates the version and makes it the program's active questionnaire.
     */
    QuestionnaireVersionDto publish(TenantContext tenant, UUID programId, UUID versionId, String actor);

    List<QuestionnaireVersionDto> listVersions(TenantContext tenant, UUID programId);

    QuestionnaireVersionDto getVersion(TenantContext tenant, UUID versionId);

    QuestionnaireVersion getActiveVersion(TenantContext tenant, UUID programId);
}
