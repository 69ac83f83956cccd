package uk.gegc.aegis.shared.tenant;

import java.util.Objects;
import java.util.UUID;

/**
 * A tenant identifier that has passed {@link TenantContextGuard} validation.
 *
 * <p>Every tenant-scoped repository method takes one of these as its first argument, so a query
 * cannot be issued without a bound tenant. Instances are only created by the guard.</p>
 */
public final class TenantContext {

    private final UUID tenantId;

    TenantContext(UUID tenantId) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    }

    public UUID getTenantId() {
        return tenantId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TenantContext that)) return false;
        return tenantId.equals(that.tenantId);
    }

    @Override
    public int hashCode() {
        return tenantId.hashCode();
    }

    @Override
    public String toString() {
        return "TenantContext[" + tenantId + "]";
    }
}
