package uk.gegc.aegis.features.questionnaire.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.UUID;

/**
 * One edition of a program's questionnaire. Rows are written once and never updated;
 * a new edition is a new row with the next version number.
 */
@Entity
@Immutable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "questionnaire_versions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_questionnaire_versions_program_version",
                columnNames = {"program_id", "version_number"}))
public class QuestionnaireVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "program_id", nullable = false, updatable = false)
    private UUID programId;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Convert(converter = QuestionnaireDefinitionConverter.class)
    @Column(name = "definition", nullable = false, updatable = false, columnDefinition = "LONGTEXT")
    private QuestionnaireDefinition definition;

    @Column(name = "notes", updatable = false, columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static QuestionnaireVersion create(TenantContext tenant,
                                              UUID programId,
                                              int versionNumber,
                                              QuestionnaireDefinition definition,
                                              String notes,
                                              String createdBy,
                                              Instant createdAt) {
        QuestionnaireVersion version = new QuestionnaireVersion();
        version.tenantId = tenant.getTenantId();
        version.programId = programId;
        version.versionNumber = versionNumber;
        version.definition = definition;
        version.notes = notes;
        version.createdBy = createdBy;
        version.createdAt = createdAt;
        return version;
    }
}
