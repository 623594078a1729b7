package com.example.environment_service.repository;

import com.example.environment_service.model.SandboxUser;

import java.util.List;
import java.util.Optional;

public interface SandboxUserRepository {

    SandboxUser save(SandboxUser user);

    Optional<SandboxUser> findById(String id);

    List<SandboxUser> findAll();
}
