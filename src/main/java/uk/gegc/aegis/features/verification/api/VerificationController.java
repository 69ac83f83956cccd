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
import org.springframework.web.bind.annotation.*;
import uk.gegc.aegis.features.partner.config.PartnerProperties;
import uk.gegc.aegis.features.partner.infra.security.PartnerPrincipal;
import uk.gegc.aegis.features.verification.api.dto.CodeCheckResponse;
import uk.gegc.aegis.features.verification.api.dto.RedeemCodeRequest;
import uk.gegc.aegis.features.verification.api.dto.RedeemCodeResponse;
import uk.gegc.aegis.features.verification.application.RedemptionResult;
import uk.gegc.aegis.features.verification.application.VerificationCodeService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.ratelimit.RateLimitService;
import uk.gegc.aegis.shared.tenant.TenantContext;

@Tag(name = "Partner Verification", description = "Checkout-time code redemption for partners")
@RestController
@RequestMapping("/api/v1/verify")
@RequiredArgsConstructor
public class VerificationController {

    private final VerificationCodeService verificationCodeService;
    private final RateLimitService rateLimitService;
    private final PartnerProperties partnerProperties;

    @Operation(summary = "Redeem a verification code",
            description = "Consumes the code. Of several concurrent calls for one code exactly one succeeds.",
            security = @SecurityRequirement(name = OpenApiConfig.PARTNER_API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code redeemed"),
            @ApiResponse(responseCode = "400", description = "Malformed request or code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid API key",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "error = not_found"),
            @ApiResponse(responseCode = "409", description = "error = already_used or expired"),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<RedeemCodeResponse> redeem(
            @Valid @RequestBody RedeemCodeRequest request,
            @AuthenticationPrincipal PartnerPrincipal partner,
            TenantContext tenant
    ) {
        rateLimitService.checkRateLimit("partner-verify", partner.partnerId().toString(),
                partnerProperties.getVerifyRateLimitPerMinute());

        RedemptionResult result = verificationCodeService.redeem(
                tenant, partner.partnerId(), request.code(), request.transactionId(), request.metadata());
        return ResponseEntity.status(statusFor(result)).body(RedeemCodeResponse.from(result));
    }

    @Operation(summary = "Check a verification code",
            description = "Reports whether the code could be redeemed now without consuming it.",
            security = @SecurityRequirement(name = OpenApiConfig.PARTNER_API_KEY_SCHEME))
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Classification of the code"),
            @ApiResponse(responseCode = "400", description = "Malformed code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid API key",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{code}")
    public ResponseEntity<CodeCheckResponse> check(
            @PathVariable String code,
            @AuthenticationPrincipal PartnerPrincipal partner,
            TenantContext tenant
    ) {
        rateLimitService.checkRateLimit("partner-verify", partner.partnerId().toString(),
                partnerProperties.getVerifyRateLimitPerMinute());
        return ResponseEntity.ok(verificationCodeService.checkOnly(tenant, code));
    }

    private static HttpStatus statusFor(RedemptionResult result) {
        if (result.valid()) {
            return HttpStatus.OK;
        }
        return switch (result.failure()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_USED, EXPIRED -> HttpStatus.CONFLICT;
        };
    }
}
