package uk.gegc.aegis.features.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.audit.domain.model.AuditLog;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AuditLogDto", description = "One audit trail entry")
public record AuditLogDto(
        @Schema(description = "Entry id") UUID id,
        @Schema(description = "Action name", example = "code.verified") String action,
        @Schema(description = "Kind of entity affected", example = "verification_code") String entityType,
        @Schema(description = "Id of the entity affected") UUID entityId,
        @Schema(description = "Who performed the action", example = "partner:3f2a...") String actor,
        @Schema(description = "JSON details") String details,
        @Schema(description = "When the entry was recorded") Instant createdAt
) {
    public static AuditLogDto from(AuditLog log) {
        return new AuditLogDto(
                log.getId(),
                log.getAction(),
                log.getEntityType(),
                log.getEntityId(),
                log.getActor(),
                log.getDetails(),
                log.getCreatedAt()
        );
    }
}
