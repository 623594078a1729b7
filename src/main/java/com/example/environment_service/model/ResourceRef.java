package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRef {
    private ResourceKind kind;
    private String namespace;
    private String name;
    private String uid;
    private Instant createdAt;
}
