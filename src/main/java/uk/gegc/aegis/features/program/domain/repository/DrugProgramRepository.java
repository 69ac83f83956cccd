package uk.gegc.aegis.features.program.domain.repository;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.program.domain.model.DrugProgram;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface DrugProgramRepository extends Repository<DrugProgram, UUID> {

    DrugProgram saveAndFlush(DrugProgram program);

    @Query("SELECT p FROM DrugProgram p WHERE p.id = :id AND p.tenantId = :#{#tenant.tenantId}")
    Optional<DrugProgram> findById(@Param("tenant") TenantContext tenant, @Param("id") UUID id);

    /**
     * Unscoped: this is how an anonymous patient reaches a program, and the program's tenant is
     * bound from the returned row.
     */
    @Query("SELECT p FROM DrugProgram p WHERE p.slug = :slug")
    Optional<DrugProgram> findBySlug(@Param("slug") String slug);

    /**
     * Unscoped uniqueness probe; slugs are global because they appear in public URLs.
     */
    @Query("SELECT CASE WHEN COUNT(p) > 0 THEN true ELSE false END FROM DrugProgram p WHERE p.slug = :slug")
    boolean existsBySlug(@Param("slug") String slug);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE DrugProgram p
            SET p.activeQuestionnaireVersionId = :versionId, p.updatedAt = :now
            WHERE p.id = :programId AND p.tenantId = :#{#tenant.tenantId}
            """)
    int activateVersion(@Param("tenant") TenantContext tenant,
                        @Param("programId") UUID programId,
                        @Param("versionId") UUID versionId,
                        @Param("now") Instant now);
}
