package com.example.environment_service;

import com.example.environment_service.config.OrchestrationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(OrchestrationProperties.class)
public class EnvironmentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnvironmentServiceApplication.class, args);
    }
}
