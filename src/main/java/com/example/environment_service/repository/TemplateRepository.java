package com.example.environment_service.repository;

import com.example.environment_service.model.Template;

import java.util.List;
import java.util.Optional;

public interface TemplateRepository {

    Template save(Template template);

    Optional<Template> findById(String id);

    List<Template> findAll();

    void delete(String id);
}
