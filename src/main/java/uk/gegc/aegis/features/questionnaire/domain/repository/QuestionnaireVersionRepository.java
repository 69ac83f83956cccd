package uk.gegc.aegis.features.questionnaire.domain.repository;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireVersion;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface QuestionnaireVersionRepository extends Repository<QuestionnaireVersion, UUID> {

    QuestionnaireVersion saveAndFlush(QuestionnaireVersion version);

    @Query("""
            SELECT v FROM QuestionnaireVersion v
            WHERE v.id = :id AND v.tenantId = :#{#tenant.tenantId}
            """)
    Optional<QuestionnaireVersion> findById(@Param("tenant") TenantContext tenant, @Param("id") UUID id);

    @Query("""
            SELECT v FROM QuestionnaireVersion v
            WHERE v.programId = :programId AND v.tenantId = :#{#tenant.tenantId}
            ORDER BY v.versionNumber DESC
            """)
    List<QuestionnaireVersion> findByProgram(@Param("tenant") TenantContext tenant, @Param("programId") UUID programId);

    @Query("""
            SELECT COALESCE(MAX(v.versionNumber), 0) FROM QuestionnaireVersion v
            WHERE v.programId = :programId AND v.tenantId = :#{#tenant.tenantId}
            """)
    int findMaxVersionNumber(@Param("tenant") TenantContext tenant, @Param("programId") UUID programId);
}
