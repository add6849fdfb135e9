package com.example.ContextRetriever;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextRetrieverApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextRetrieverApplication.class, args);
    }
}
