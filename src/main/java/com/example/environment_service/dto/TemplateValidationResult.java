package com.example.environment_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateValidationResult {
    private String templateId;
    private boolean valid;
    private String imageTag;
    private List<String> problems;
}
