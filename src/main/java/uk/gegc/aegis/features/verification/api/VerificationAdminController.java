package uk.gegc.aegis.features.verification.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.aegis.features.verification.application.VerificationCodeService;
import uk.gegc.aegis.shared.config.OpenApiConfig;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.Map;

@Tag(name = "Admin: Verification Codes")
@RestController
@RequestMapping("/api/v1/admin/verification-codes")
@RequiredArgsConstructor
@PreAuthorize("hasRole('OPERATOR')")
@SecurityRequirement(name = OpenApiConfig.OPERATOR_SCHEME)
public class VerificationAdminController {

    private final VerificationCodeService verificationCodeService;

    @Operation(summary = "Run the expiry sweep now",
            description = "Marks the tenant's unused codes past expiry as expired. Safe to repeat.")
    @PostMapping("/sweep")
    public ResponseEntity<Map<String, Integer>> sweep(TenantContext tenant, Authentication authentication) {
        int expired = verificationCodeService.markExpired(tenant, authentication.getName());
        return ResponseEntity.ok(Map.of("expiredCount", expired));
    }
}
