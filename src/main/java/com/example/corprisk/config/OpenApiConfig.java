package com.example.corprisk.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("corp-risk-java-lite API")
                        .version("0.1.0")
                        .description("Six-dimension behavioural risk report built from company registry records. "
                                + "POST /api/analyze returns the full report; /api/analyze/stream emits SSE "
                                + "events (profile, dimension..., complete)."));
    }
}
