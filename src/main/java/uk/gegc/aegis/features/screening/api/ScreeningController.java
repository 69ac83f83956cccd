package uk.gegc.aegis.features.screening.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import uk.gegc.aegis.features.program.api.dto.PublicProgramView;
import uk.gegc.aegis.features.program.application.DrugProgramService;
import uk.gegc.aegis.features.screening.api.dto.SessionStatusDto;
import uk.gegc.aegis.features.screening.api.dto.StartSessionRequest;
import uk.gegc.aegis.features.screening.api.dto.StartSessionResponse;
import uk.gegc.aegis.features.screening.api.dto.SubmitAnswersRequest;
import uk.gegc.aegis.features.screening.api.dto.SubmitAnswersResponse;
import uk.gegc.aegis.features.screening.application.ScreeningSessionService;
import uk.gegc.aegis.features.screening.infra.security.ScreeningSessionPrincipal;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

@Tag(name = "Screening", description = "Patient-facing screening flow")
@RestController
@RequestMapping("/api/v1/public")
@RequiredArgsConstructor
public class ScreeningController {

    private final DrugProgramService drugProgramService;
    private final ScreeningSessionService screeningSessionService;

    @Operation(summary = "Get a program's public questionnaire",
            description = "Returns the questions and disclaimers of the program's published questionnaire. Rules are not included.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Public program view"),
            @ApiResponse(responseCode = "404", description = "No active program with a published questionnaire",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/programs/{slug}")
    public ResponseEntity<PublicProgramView> getProgram(
            @Parameter(description = "Public program slug", example = "lipitor-otc") @PathVariable String slug
    ) {
        return ResponseEntity.ok(drugProgramService.getPublicProgram(slug));
    }

    @Operation(summary = "Start a screening session",
            description = "Creates a session pinned to the program's active questionnaire version and returns its bearer token.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session started"),
            @ApiResponse(responseCode = "404", description = "Program not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/programs/{slug}/sessions")
    public ResponseEntity<StartSessionResponse> startSession(
            @PathVariable String slug,
            @RequestBody(required = false) StartSessionRequest request
    ) {
        StartSessionRequest options = request == null ? new StartSessionRequest(null) : request;
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(screeningSessionService.start(slug, options.path()));
    }

    @Operation(summary = "Submit answers",
            description = "Validates the complete answer set, evaluates it and completes the session. A session completes once.",
            security = @SecurityRequirement(name = OpenApiConfig.SESSION_TOKEN_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session completed with an outcome"),
            @ApiResponse(responseCode = "400", description = "One or more answers are missing or invalid",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Token belongs to another session",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/sessions/{sessionId}/answers")
    public ResponseEntity<SubmitAnswersResponse> submitAnswers(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SubmitAnswersRequest request,
            @AuthenticationPrincipal ScreeningSessionPrincipal principal,
            TenantContext tenant
    ) {
        ScreeningSessionPrincipal.requireSession(principal, sessionId);
        return ResponseEntity.ok(screeningSessionService.submitAnswers(tenant, sessionId, request.answers()));
    }

    @Operation(summary = "Get session status", security = @SecurityRequirement(name = OpenApiConfig.SESSION_TOKEN_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session status"),
            @ApiResponse(responseCode = "403", description = "Token belongs to another session",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionStatusDto> getSession(
            @PathVariable UUID sessionId,
            @AuthenticationPrincipal ScreeningSessionPrincipal principal,
            TenantContext tenant
    ) {
        ScreeningSessionPrincipal.requireSession(principal, sessionId);
        return ResponseEntity.ok(screeningSessionService.getSession(tenant, sessionId));
    }
}
