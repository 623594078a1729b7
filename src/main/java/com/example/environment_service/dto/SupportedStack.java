package com.example.environment_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SupportedStack {
    private String language;
    // version -> base image
    private Map<String, String> versions;
    private List<String> frameworks;
}
