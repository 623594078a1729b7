package com.example.environment_service.repository;

import com.example.environment_service.model.SandboxUser;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySandboxUserRepository implements SandboxUserRepository {

    private final Map<String, SandboxUser> users = new ConcurrentHashMap<>();

    @Override
    public SandboxUser save(SandboxUser user) {
        users.put(user.getId(), user);
        return user;
    }

    @Override
    public Optional<SandboxUser> findById(String id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public List<SandboxUser> findAll() {
        return new ArrayList<>(users.values());
    }
}
