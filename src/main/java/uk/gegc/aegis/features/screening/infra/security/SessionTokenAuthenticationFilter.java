package uk.gegc.aegis.features.screening.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates {@code Authorization: Bearer <session token>} requests as a {@link ScreeningSessionPrincipal}.
 * Requests without a valid token pass through unauthenticated.
 */
@Slf4j
public class SessionTokenAuthenticationFilter extends OncePerRequestFilter {

    private final SessionTokenService sessionTokenService;

    public SessionTokenAuthenticationFilter(SessionTokenService sessionTokenService) {
        this.sessionTokenService = sessionTokenService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            Optional<ScreeningSessionPrincipal> principal = sessionTokenService.parse(authHeader.substring(7));
            if (principal.isPresent()) {
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal.get(), null, List.of(new SimpleGrantedAuthority(ScreeningSessionPrincipal.ROLE)));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.warn("Invalid session token received for URI: {}", request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
