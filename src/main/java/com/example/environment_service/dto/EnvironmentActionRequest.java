package com.example.environment_service.dto;

import com.example.environment_service.model.EnvironmentAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentActionRequest {
    private String environmentId;
    private EnvironmentAction action;
    private boolean force;
}
