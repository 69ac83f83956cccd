package uk.gegc.aegis.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.www.BasicAuthenticationFilter;
import uk.gegc.aegis.features.partner.application.PartnerService;
import uk.gegc.aegis.features.partner.config.PartnerProperties;
import uk.gegc.aegis.features.partner.infra.security.PartnerApiKeyAuthenticationFilter;
import uk.gegc.aegis.features.screening.infra.security.SessionTokenAuthenticationFilter;
import uk.gegc.aegis.features.screening.infra.security.SessionTokenService;
import uk.gegc.aegis.shared.api.problem.ErrorTypes;
import uk.gegc.aegis.shared.api.problem.ProblemDetailBuilder;

import java.io.IOException;

/**
 * Three caller kinds share one stateless chain:
 * patients with a session token, partners with an API key and operators with HTTP Basic.
 */
@Configuration
@RequiredArgsConstructor
@EnableMethodSecurity
public class SecurityConfig {

    private final SessionTokenService sessionTokenService;
    private final PartnerService partnerService;
    private final PartnerProperties partnerProperties;
    private final AdminProperties adminProperties;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity httpSecurity) throws Exception {
        AuthenticationEntryPoint entryPoint = (request, response, ex) -> writeAuthResponse(request, response, false);

        httpSecurity
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(basic -> basic.authenticationEntryPoint(entryPoint))
                .sessionManagement(sessionManagement -> sessionManagement.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint(entryPoint)
                        .accessDeniedHandler((request, response, ex) -> writeAuthResponse(request, response, true)))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        // API Documentation and health
                        .requestMatchers(HttpMethod.GET, "/v3/api-docs/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .requestMatchers(HttpMethod.GET, "/actuator/health", "/actuator/health/**").permitAll()
                        // Anonymous patients reach a program by slug and start a session
                        .requestMatchers(HttpMethod.GET, "/api/v1/public/programs/*").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/v1/public/programs/*/sessions").permitAll()
                        .requestMatchers("/api/v1/public/sessions/**").hasRole("SCREENING_SESSION")
                        .requestMatchers("/api/v1/verify", "/api/v1/verify/**").hasRole("PARTNER")
                        .requestMatchers("/api/v1/admin/**").hasRole("OPERATOR")
                        .anyRequest().denyAll())
                .addFilterBefore(new SessionTokenAuthenticationFilter(sessionTokenService), BasicAuthenticationFilter.class)
                .addFilterBefore(
                        new PartnerApiKeyAuthenticationFilter(partnerService, partnerProperties.getApiKeyHeader()),
                        BasicAuthenticationFilter.class
                );

        return httpSecurity.build();
    }

    @Bean
    public UserDetailsService operatorUserDetailsService() {
        return new InMemoryUserDetailsManager(User.withUsername(adminProperties.getUsername())
                .password(adminProperties.getPassword())
                .roles("OPERATOR")
                .build());
    }

    private void writeAuthResponse(HttpServletRequest request, HttpServletResponse response, boolean forbidden) throws IOException {
        HttpStatus status = forbidden ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED;

        ProblemDetail problemDetail = forbidden
                ? ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ACCESS_DENIED,
                "Access Denied",
                "You do not have permission to access this resource",
                request
        )
                : ProblemDetailBuilder.create(
                HttpStatus.UNAUTHORIZED,
                ErrorTypes.UNAUTHORIZED,
                "Unauthorized",
                "Authentication is required to access this resource",
                request
        );

        response.setStatus(status.value());
        response.setContentType("application/problem+json");
        response.getWriter().write(objectMapper.writeValueAsString(problemDetail));
    }
}
