package com.sldce.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI sldceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SLDCE API")
                        .description("Label-noise detection, human review and correction of training datasets.")
                        .version("v1")
                        .license(new License().name("MIT"))
                );
    }
}
