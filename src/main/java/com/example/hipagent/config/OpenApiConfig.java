package com.example.hipagent.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "HIP Agent API",
                version = "v1",
                description = "Answers multiple-choice questions (/api/agent) and exposes corpus retrieval (/api/rag)"
        )
)
public class OpenApiConfig {
}
