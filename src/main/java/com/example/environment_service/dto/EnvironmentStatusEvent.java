package com.example.environment_service.dto;

import com.example.environment_service.exception.ErrorKind;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentStatusEvent {
    private String environmentId;
    private String identity;
    private String namespace;
    private EnvironmentState state;
    private String accessUrl;
    private ErrorKind errorKind;
    private String message;
    private Instant timestamp;

    public static EnvironmentStatusEvent of(Environment environment, Instant timestamp) {
        return EnvironmentStatusEvent.builder()
                .environmentId(environment.getId())
                .identity(environment.getIdentity())
                .namespace(environment.getNamespace())
                .state(environment.getState())
                .accessUrl(environment.getAccessUrl())
                .errorKind(environment.getLastErrorKind())
                .message(environment.getStatusMessage())
                .timestamp(timestamp)
                .build();
    }

    public static EnvironmentStatusEvent failure(String identity, ErrorKind errorKind, String message, Instant timestamp) {
        return EnvironmentStatusEvent.builder()
                .identity(identity)
                .state(EnvironmentState.FAILED)
                .errorKind(errorKind)
                .message(message)
                .timestamp(timestamp)
                .build();
    }
}
