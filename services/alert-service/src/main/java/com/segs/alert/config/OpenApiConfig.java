package com.segs.alert.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger Configuration
 *
 * Accessible at: /swagger-ui.html
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:alert-service}")
    private String applicationName;

    @Bean
    public OpenAPI alertServiceOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("SEGS Alert Service API")
                .version("1.0.0")
                .description("""
                    Operator and user alert queries plus the acknowledge / resolve lifecycle.

                    Service: %s
                    """.formatted(applicationName)));
    }
}
