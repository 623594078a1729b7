package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deterministic build descriptor for a stack: Dockerfile text and the image tag it maps to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompiledImage {
    private String recipe;
    private String imageTag;
    private String baseImage;
    private boolean buildSubmitted;
}
