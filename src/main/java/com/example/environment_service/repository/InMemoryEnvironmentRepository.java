package com.example.environment_service.repository;

import com.example.environment_service.model.Environment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Default in-process store. Records are copied on the way in and out so callers never
 * share a mutable instance across threads.
 */
@Repository
@Slf4j
public class InMemoryEnvironmentRepository implements EnvironmentRepository {

    private final Map<String, Environment> environments = new ConcurrentHashMap<>();

    @Override
    public Environment save(Environment environment) {
        environments.put(environment.getId(), environment.toBuilder().build());
        log.debug("Saved environment {} in state {}", environment.getId(), environment.getState());
        return environment;
    }

    @Override
    public Optional<Environment> findById(String id) {
        Environment found = environments.get(id);
        return found == null ? Optional.empty() : Optional.of(found.toBuilder().build());
    }

    @Override
    public List<Environment> findByNamespacePrefix(String prefix) {
        return environments.values().stream()
                .filter(env -> env.getNamespace() != null && env.getNamespace().startsWith(prefix))
                .sorted(Comparator.comparing(Environment::getNamespace).thenComparing(Environment::getId))
                .map(env -> env.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<Environment> findByUserId(String userId) {
        return environments.values().stream()
                .filter(env -> userId.equals(env.getUserId()))
                .map(env -> env.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<Environment> findAll() {
        return new ArrayList<>(environments.values()).stream()
                .map(env -> env.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String id) {
        environments.remove(id);
    }
}
