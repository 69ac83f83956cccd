package uk.gegc.aegis.features.program.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.aegis.features.program.api.dto.CreateProgramRequest;
import uk.gegc.aegis.features.program.api.dto.DrugProgramDto;
import uk.gegc.aegis.features.program.api.dto.UpdateProgramStatusRequest;
import uk.gegc.aegis.features.program.application.DrugProgramService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

@Tag(name = "Admin: Programs", description = "Drug program management for operators")
@RestController
@RequestMapping("/api/v1/admin/programs")
@RequiredArgsConstructor
@PreAuthorize("hasRole('OPERATOR')")
@SecurityRequirement(name = OpenApiConfig.OPERATOR_SCHEME)
public class ProgramAdminController {

    private final DrugProgramService drugProgramService;

    @Operation(summary = "Create a drug program", description = "New programs start in DRAFT.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Program created"),
            @ApiResponse(responseCode = "400", description = "Validation error or invalid tenant id",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Slug already taken",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<DrugProgramDto> createProgram(
            @Valid @RequestBody CreateProgramRequest request,
            TenantContext tenant,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(drugProgramService.createProgram(tenant, request, authentication.getName()));
    }

    @Operation(summary = "Get a drug program")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Program"),
            @ApiResponse(responseCode = "404", description = "Program not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{programId}")
    public ResponseEntity<DrugProgramDto> getProgram(@PathVariable UUID programId, TenantContext tenant) {
        return ResponseEntity.ok(drugProgramService.getProgram(tenant, programId));
    }

    @Operation(summary = "Change a program's status",
            description = "Activating requires a published questionnaire version.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated program"),
            @ApiResponse(responseCode = "400", description = "Program cannot move to that status",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Program not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{programId}/status")
    public ResponseEntity<DrugProgramDto> updateStatus(
            @PathVariable UUID programId,
            @Valid @RequestBody UpdateProgramStatusRequest request,
            TenantContext tenant,
            Authentication authentication
    ) {
        return ResponseEntity.ok(drugProgramService.updateStatus(tenant, programId, request.status(), authentication.getName()));
    }
}
