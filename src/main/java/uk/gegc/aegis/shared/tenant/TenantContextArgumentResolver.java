package uk.gegc.aegis.shared.tenant;

import org.springframework.core.MethodParameter;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import uk.gegc.aegis.shared.security.TenantScopedPrincipal;

/**
 * Supplies a bound {@link TenantContext} to controller methods.
 *
 * <p>Session-token and API-key callers are bound to the tenant their credential carries and any
 * tenant header they send is ignored. Operators name the tenant in the tenant header.</p>
 */
public class TenantContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final TenantContextGuard guard;
    private final String tenantHeader;

    public TenantContextArgumentResolver(TenantContextGuard guard, String tenantHeader) {
        this.guard = guard;
        this.tenantHeader = tenantHeader;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return TenantContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof TenantScopedPrincipal principal) {
            return guard.bind(principal.tenantId());
        }
        return guard.bind(webRequest.getHeader(tenantHeader));
    }
}
