package uk.gegc.aegis.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import uk.gegc.aegis.shared.tenant.TenantContextArgumentResolver;
import uk.gegc.aegis.shared.tenant.TenantContextGuard;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final TenantContextGuard tenantContextGuard;
    private final String tenantHeader;

    public WebConfig(TenantContextGuard tenantContextGuard,
                     @Value("${app.tenant.header:X-Tenant-Id}") String tenantHeader) {
        this.tenantContextGuard = tenantContextGuard;
        this.tenantHeader = tenantHeader;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new TenantContextArgumentResolver(tenantContextGuard, tenantHeader));
    }
}
