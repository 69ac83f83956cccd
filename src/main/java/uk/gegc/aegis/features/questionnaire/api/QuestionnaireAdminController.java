package uk.gegc.aegis.features.questionnaire.api;

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
import uk.gegc.aegis.features.questionnaire.api.dto.CreateQuestionnaireVersionRequest;
import uk.gegc.aegis.features.questionnaire.api.dto.QuestionnaireVersionDto;
import uk.gegc.aegis.features.questionnaire.application.QuestionnaireService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.List;
import java.util.UUID;

@Tag(name = "Admin: Questionnaires", description = "Versioned questionnaires and their publication")
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('OPERATOR')")
@SecurityRequirement(name = OpenApiConfig.OPERATOR_SCHEME)
public class QuestionnaireAdminController {

    private final QuestionnaireService questionnaireService;

    @Operation(summary = "Create a questionnaire version",
            description = "Stores an immutable version numbered after the latest one. Supply either a ruleset or legacy logic.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Version created"),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Program not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Ruleset references unknown questions, operators or options",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/programs/{programId}/questionnaires")
    public ResponseEntity<QuestionnaireVersionDto> createVersion(
            @PathVariable UUID programId,
            @Valid @RequestBody CreateQuestionnaireVersionRequest request,
            TenantContext tenant,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(questionnaireService.createVersion(tenant, programId, request, authentication.getName()));
    }

    @Operation(summary = "List a program's questionnaire versions", description = "Newest version first.")
    @GetMapping("/programs/{programId}/questionnaires")
    public ResponseEntity<List<QuestionnaireVersionDto>> listVersions(@PathVariable UUID programId, TenantContext tenant) {
        return ResponseEntity.ok(questionnaireService.listVersions(tenant, programId));
    }

    @Operation(summary = "Get a questionnaire version")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Version"),
            @ApiResponse(responseCode = "404", description = "Version not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/questionnaires/{versionId}")
    public ResponseEntity<QuestionnaireVersionDto> getVersion(@PathVariable UUID versionId, TenantContext tenant) {
        return ResponseEntity.ok(questionnaireService.getVersion(tenant, versionId));
    }

    @Operation(summary = "Publish a questionnaire version",
            description = "Re-validates the ruleset and makes the version the program's active questionnaire.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Version published"),
            @ApiResponse(responseCode = "404", description = "Program or version not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Ruleset is not publishable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/programs/{programId}/questionnaires/{versionId}/publish")
    public ResponseEntity<QuestionnaireVersionDto> publish(
            @PathVariable UUID programId,
            @PathVariable UUID versionId,
            TenantContext tenant,
            Authentication authentication
    ) {
        return ResponseEntity.ok(questionnaireService.publish(tenant, programId, versionId, authentication.getName()));
    }
}
