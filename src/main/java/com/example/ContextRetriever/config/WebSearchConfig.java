package com.example.ContextRetriever.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebSearchConfig {

    @Bean
    public WebClient webSearchClient(WebClient.Builder builder, RetrieverProperties properties) {
        return builder
                .baseUrl(properties.web().baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
