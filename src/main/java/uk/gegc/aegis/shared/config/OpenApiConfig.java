package uk.gegc.aegis.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String SESSION_TOKEN_SCHEME = "sessionToken";
    public static final String PARTNER_API_KEY_SCHEME = "partnerApiKey";
    public static final String OPERATOR_SCHEME = "operatorBasic";

    @Bean
    public OpenAPI aegisOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Aegis Eligibility API")
                        .version("v1")
                        .description("Patient screening, eligibility outcomes and single-use verification codes"))
                .components(new Components()
                        .addSecuritySchemes(SESSION_TOKEN_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT"))
                        .addSecuritySchemes(PARTNER_API_KEY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-API-Key"))
                        .addSecuritySchemes(OPERATOR_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("basic")));
    }
}
