package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Language stack a template compiles to an image from.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StackConfig {
    private String language;
    private String version;
    private String framework;
    @Singular("packageName")
    private List<String> packages;
    @Singular
    private List<Integer> exposedPorts;
    @Singular
    private Map<String, String> environmentVariables;
}
