package uk.gegc.aegis.features.verification.api;

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
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.aegis.features.screening.infra.security.ScreeningSessionPrincipal;
import uk.gegc.aegis.features.verification.api.dto.IssueCodeRequest;
import uk.gegc.aegis.features.verification.api.dto.VerificationCodeDto;
import uk.gegc.aegis.features.verification.application.IssuedCode;
import uk.gegc.aegis.features.verification.application.VerificationCodeService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

@Tag(name = "Screening", description = "Patient-facing screening flow")
@RestController
@RequestMapping("/api/v1/public/sessions")
@RequiredArgsConstructor
public class SessionCodeController {

    private final VerificationCodeService verificationCodeService;

    @Operation(summary = "Get the session's verification code",
            description = "Issues the code for an eligible session. Repeating the call returns the same code.",
            security = @SecurityRequirement(name = OpenApiConfig.SESSION_TOKEN_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Code issued"),
            @ApiResponse(responseCode = "200", description = "The session already had a code"),
            @ApiResponse(responseCode = "400", description = "Invalid expiry",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Token belongs to another session",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session outcome is not eligible",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "No unique code could be generated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/code")
    public ResponseEntity<VerificationCodeDto> issueCode(
            @PathVariable UUID sessionId,
            @Valid @RequestBody(required = false) IssueCodeRequest request,
            @AuthenticationPrincipal ScreeningSessionPrincipal principal,
            TenantContext tenant
    ) {
        ScreeningSessionPrincipal.requireSession(principal, sessionId);
        IssueCodeRequest options = request == null ? new IssueCodeRequest(null, null) : request;
        IssuedCode issued = verificationCodeService.issue(tenant, sessionId, options.codeType(), options.expiresInHours());
        return ResponseEntity.status(issued.created() ? HttpStatus.CREATED : HttpStatus.OK).body(issued.code());
    }
}
