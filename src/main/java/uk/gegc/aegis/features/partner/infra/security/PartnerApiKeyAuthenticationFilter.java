package uk.gegc.aegis.features.partner.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import uk.gegc.aegis.features.partner.application.PartnerService;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates partner calls carrying an API key header. Requests without a valid key pass
 * through unauthenticated and are rejected by the authorization rules.
 */
@Slf4j
public class PartnerApiKeyAuthenticationFilter extends OncePerRequestFilter {

    private final PartnerService partnerService;
    private final String headerName;

    public PartnerApiKeyAuthenticationFilter(PartnerService partnerService, String headerName) {
        this.partnerService = partnerService;
        this.headerName = headerName;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String rawKey = request.getHeader(headerName);

        if (rawKey != null && !rawKey.isBlank()) {
            Optional<PartnerPrincipal> principal = partnerService.authenticate(rawKey.trim());
            if (principal.isPresent()) {
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal.get(), null, List.of(new SimpleGrantedAuthority(PartnerPrincipal.ROLE)));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.warn("Invalid API key received for URI: {}", request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/v1/verify");
    }
}
