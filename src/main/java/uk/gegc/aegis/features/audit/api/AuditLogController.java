package uk.gegc.aegis.features.audit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.aegis.features.audit.api.dto.AuditLogDto;
import uk.gegc.aegis.features.audit.application.AuditLogService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

@Tag(name = "Admin: Audit Logs")
@RestController
@RequestMapping("/api/v1/admin/audit-logs")
@RequiredArgsConstructor
@PreAuthorize("hasRole('OPERATOR')")
@SecurityRequirement(name = OpenApiConfig.OPERATOR_SCHEME)
public class AuditLogController {

    private final AuditLogService auditLogService;

    @Operation(summary = "List audit entries", description = "Newest first, optionally narrowed to one entity.")
    @GetMapping
    public ResponseEntity<Page<AuditLogDto>> list(
            @Parameter(description = "Only entries about this entity") @RequestParam(required = false) UUID entityId,
            @ParameterObject @PageableDefault(size = 50) Pageable pageable,
            TenantContext tenant
    ) {
        return ResponseEntity.ok(auditLogService.list(tenant, entityId, pageable));
    }
}
