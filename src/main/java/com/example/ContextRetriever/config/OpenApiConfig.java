package com.example.ContextRetriever.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "ContextRetriever API",
                version = "v1",
                description = "Context-aware retrieval over the local document store and web search"
        )
)
public class OpenApiConfig {
}
