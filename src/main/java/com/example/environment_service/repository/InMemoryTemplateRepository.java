package com.example.environment_service.repository;

import com.example.environment_service.model.Template;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryTemplateRepository implements TemplateRepository {

    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    @Override
    public Template save(Template template) {
        templates.put(template.getId(), template.toBuilder().build());
        return template;
    }

    @Override
    public Optional<Template> findById(String id) {
        Template found = templates.get(id);
        return found == null ? Optional.empty() : Optional.of(found.toBuilder().build());
    }

    @Override
    public List<Template> findAll() {
        return new ArrayList<>(templates.values());
    }

    @Override
    public void delete(String id) {
        templates.remove(id);
    }
}
