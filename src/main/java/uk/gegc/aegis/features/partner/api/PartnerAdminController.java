package uk.gegc.aegis.features.partner.api;

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
import uk.gegc.aegis.features.partner.api.dto.CreatePartnerRequest;
import uk.gegc.aegis.features.partner.api.dto.IssueApiKeyRequest;
import uk.gegc.aegis.features.partner.api.dto.IssuedApiKeyDto;
import uk.gegc.aegis.features.partner.api.dto.PartnerDto;
import uk.gegc.aegis.features.partner.application.PartnerService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.UUID;

@Tag(name = "Admin: Partners", description = "Redemption partners and their API keys")
@RestController
@RequestMapping("/api/v1/admin/partners")
@RequiredArgsConstructor
@PreAuthorize("hasRole('OPERATOR')")
@SecurityRequirement(name = OpenApiConfig.OPERATOR_SCHEME)
public class PartnerAdminController {

    private final PartnerService partnerService;

    @Operation(summary = "Register a partner")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Partner created"),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<PartnerDto> createPartner(
            @Valid @RequestBody CreatePartnerRequest request,
            TenantContext tenant,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(partnerService.createPartner(tenant, request, authentication.getName()));
    }

    @Operation(summary = "Issue an API key", description = "The raw key appears in this response only.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Key issued"),
            @ApiResponse(responseCode = "404", description = "Partner not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{partnerId}/api-keys")
    public ResponseEntity<IssuedApiKeyDto> issueApiKey(
            @PathVariable UUID partnerId,
            @Valid @RequestBody(required = false) IssueApiKeyRequest request,
            TenantContext tenant,
            Authentication authentication
    ) {
        Integer expiresInDays = request == null ? null : request.expiresInDays();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(partnerService.issueApiKey(tenant, partnerId, expiresInDays, authentication.getName()));
    }

    @Operation(summary = "Revoke an API key")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Key revoked"),
            @ApiResponse(responseCode = "404", description = "Key not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{partnerId}/api-keys/{keyId}")
    public ResponseEntity<Void> revokeApiKey(
            @PathVariable UUID partnerId,
            @PathVariable UUID keyId,
            TenantContext tenant,
            Authentication authentication
    ) {
        partnerService.revokeApiKey(tenant, partnerId, keyId, authentication.getName());
        return ResponseEntity.noContent().build();
    }
}
