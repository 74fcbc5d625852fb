package com.purchasingpower.remediation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API description served at {@code /openapi.json}, with Swagger UI at {@code /docs}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI remediationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Secure Code Remediation API")
                        .description("Generates fixes for reported vulnerabilities and validates them with a security scanner")
                        .version("1.0.0"));
    }
}
