package uk.gegc.aegis.shared.tenant;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validates tenant identifiers and binds them into a {@link TenantContext}.
 *
 * <p>The format check runs before the value reaches any query even though every query
 * also binds it as a parameter.</p>
 */
@Component
public class TenantContextGuard {

    private static final Pattern CANONICAL_UUID =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    public TenantContext bind(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidTenantIdException("Tenant id is required");
        }
        String normalized = tenantId.toLowerCase(Locale.ROOT);
        if (!CANONICAL_UUID.matcher(normalized).matches()) {
            throw new InvalidTenantIdException("Tenant id must be a canonical UUID");
        }
        return new TenantContext(UUID.fromString(normalized));
    }

    /**
     * Binds a tenant id taken from a trusted source such as a signed token claim or a stored row.
     */
    public TenantContext bind(UUID tenantId) {
        if (tenantId == null) {
            throw new InvalidTenantIdException("Tenant id is required");
        }
        return new TenantContext(tenantId);
    }
}
