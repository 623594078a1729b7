package com.example.environment_service.repository;

import com.example.environment_service.model.Environment;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for environment records.
 */
public interface EnvironmentRepository {

    Environment save(Environment environment);

    Optional<Environment> findById(String id);

    /**
     * @return environments whose namespace starts with {@code prefix}, ordered by namespace
     */
    List<Environment> findByNamespacePrefix(String prefix);

    List<Environment> findByUserId(String userId);

    List<Environment> findAll();

    void delete(String id);
}
