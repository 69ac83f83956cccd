package uk.gegc.aegis.features.program.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "drug_programs")
public class DrugProgram {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Setter(AccessLevel.NONE)
    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "brand_name", nullable = false, length = 200)
    private String brandName;

    @Setter(AccessLevel.NONE)
    @Column(name = "slug", nullable = false, unique = true, length = 120)
    private String slug;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ProgramStatus status;

    /**
     * Changed only through the publish operation.
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "active_questionnaire_version_id")
    private UUID activeQuestionnaireVersionId;

    @Setter(AccessLevel.NONE)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static DrugProgram create(TenantContext tenant, String name, String brandName, String slug, Instant now) {
        DrugProgram program = new DrugProgram();
        program.tenantId = tenant.getTenantId();
        program.name = name;
        program.brandName = brandName;
        program.slug = slug;
        program.status = ProgramStatus.DRAFT;
        program.createdAt = now;
        program.updatedAt = now;
        return program;
    }
}
