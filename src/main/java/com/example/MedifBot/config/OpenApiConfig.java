package com.example.MedifBot.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "MedifBot API",
                version = "v1",
                description = "Website chat assistant for Medif Estructuras: chat, retrieval inspection and health"
        )
)
public class OpenApiConfig {
}
