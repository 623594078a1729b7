package com.example.environment_service.service;

import com.example.environment_service.config.OrchestrationProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The supported stack matrix and its recipe fragments, read once from a classpath YAML file.
 */
@Component
@Slf4j
public class StackMatrix {

    private final Definition definition;

    public StackMatrix(OrchestrationProperties properties) {
        this(properties.getImage().getStackMatrixLocation());
    }

    StackMatrix(String location) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            this.definition = mapper.readValue(in, Definition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load stack matrix from " + location, e);
        }
        log.info("📦 Loaded stack matrix from {}: languages {}", location, definition.getLanguages().keySet());
    }

    public Language language(String name) {
        return name == null ? null : definition.getLanguages().get(name);
    }

    public Map<String, Language> languages() {
        return definition.getLanguages();
    }

    public List<String> tail() {
        return definition.getTail();
    }

    @Data
    public static class Definition {
        private Map<String, Language> languages = new LinkedHashMap<>();
        private List<String> tail = new ArrayList<>();
    }

    @Data
    public static class Language {
        private Map<String, String> versions = new LinkedHashMap<>();
        private List<String> system = new ArrayList<>();
        private List<String> setup = new ArrayList<>();
        private String packageInstall;
        private Map<String, List<String>> frameworks = new LinkedHashMap<>();
    }
}
