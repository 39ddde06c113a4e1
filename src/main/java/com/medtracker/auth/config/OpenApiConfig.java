package com.medtracker.auth.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the Authentication Gateway.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(AuthProperties authProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Authentication Gateway API")
                        .description("Session and token authentication for the medical tracker: " +
                                "login, registration, logout, session status and demo access.")
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes("sessionCookie",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.COOKIE)
                                        .name(authProperties.getSession().getCookieName())
                                        .description("Session cookie set by login, register and demo"))
                        .addSecuritySchemes("bearerAuth",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Legacy bearer token from /auth/token")));
    }
}
