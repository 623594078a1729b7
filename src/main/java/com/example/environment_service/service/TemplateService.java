package com.example.environment_service.service;

import com.example.environment_service.dto.TemplateValidationResult;
import com.example.environment_service.exception.EnvironmentException;
import com.example.environment_service.exception.NotFoundException;
import com.example.environment_service.exception.TemplateInUseException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.CompiledImage;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.QuotaOverrides;
import com.example.environment_service.model.Template;
import com.example.environment_service.repository.EnvironmentRepository;
import com.example.environment_service.repository.TemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Template catalog. A template referenced by a live environment cannot be changed or removed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TemplateService {

    private final TemplateRepository templateRepository;
    private final EnvironmentRepository environmentRepository;
    private final QuotaGovernor quotaGovernor;
    private final StackImageCompiler imageCompiler;
    private final Clock clock;

    public Template register(Template template) {
        if (template.getId() == null || template.getId().isBlank()) {
            throw new ValidationException(null, "Template id is required");
        }
        if (templateRepository.findById(template.getId()).isPresent()) {
            throw new ValidationException(template.getId(), "Template already exists: " + template.getId());
        }
        checkDefinition(template);

        Instant now = clock.instant();
        Template registered = template.toBuilder()
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .build();
        buildImage(registered);
        templateRepository.save(registered);
        log.info("📝 Registered template {} ({})", registered.getId(), registered.getName());
        return registered;
    }

    /**
     * Replaces the definition of an unreferenced template and bumps its version.
     *
     * @throws TemplateInUseException when a live environment still references it
     */
    public Template update(String templateId, Template changes) {
        Template existing = get(templateId);
        requireUnused(templateId);
        checkDefinition(changes);

        Template updated = changes.toBuilder()
                .id(templateId)
                .version(existing.getVersion() + 1)
                .createdAt(existing.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        buildImage(updated);
        templateRepository.save(updated);
        log.info("📝 Updated template {} to v{}", templateId, updated.getVersion());
        return updated;
    }

    public void delete(String templateId) {
        get(templateId);
        requireUnused(templateId);
        templateRepository.delete(templateId);
        log.info("🗑️ Deleted template {}", templateId);
    }

    public TemplateValidationResult validate(String templateId) {
        Template template = get(templateId);
        List<String> problems = new ArrayList<>();
        String imageTag = null;

        if (template.getStack() != null) {
            try {
                CompiledImage image = imageCompiler.compile(template.getStack(), template.getId(), true);
                imageTag = image.getImageTag();
                problems.addAll(imageCompiler.validateRecipe(image.getRecipe()));
            } catch (EnvironmentException e) {
                problems.add(e.getMessage());
            }
        } else if (template.getBaseImage() == null || template.getBaseImage().isBlank()) {
            problems.add("Template has neither a stack configuration nor a base image");
        } else {
            imageTag = template.getBaseImage();
            if (!template.getBaseImage().contains(":")) {
                problems.add("Base image should be pinned with a tag");
            }
        }

        try {
            quotaGovernor.resolve(templateId, template.getDefaultLimits(), QuotaOverrides.none());
        } catch (EnvironmentException e) {
            problems.add(e.getMessage());
        }

        return TemplateValidationResult.builder()
                .templateId(templateId)
                .valid(problems.isEmpty())
                .imageTag(imageTag)
                .problems(problems)
                .build();
    }

    public Template get(String templateId) {
        return templateRepository.findById(templateId)
                .orElseThrow(() -> new NotFoundException(templateId, "Template not found: " + templateId));
    }

    public List<Template> list() {
        return templateRepository.findAll().stream()
                .sorted(Comparator.comparing(Template::getId))
                .collect(Collectors.toList());
    }

    private void checkDefinition(Template template) {
        if (template.getStack() == null && (template.getBaseImage() == null || template.getBaseImage().isBlank())) {
            throw new ValidationException(template.getId(), "Template needs a stack configuration or a base image");
        }
        quotaGovernor.resolve(template.getId(), template.getDefaultLimits(), QuotaOverrides.none());
        if (template.getStack() != null) {
            CompiledImage image = imageCompiler.compile(template.getStack(), template.getId(), true);
            List<String> problems = imageCompiler.validateRecipe(image.getRecipe());
            if (!problems.isEmpty()) {
                throw new ValidationException(template.getId(), "Template recipe rejected: " + problems);
            }
        }
    }

    private void buildImage(Template template) {
        if (template.getStack() != null) {
            imageCompiler.compile(template.getStack(), template.getId(), false);
        }
    }

    private void requireUnused(String templateId) {
        long active = environmentRepository.findAll().stream()
                .filter(Environment::isActive)
                .filter(env -> templateId.equals(env.getTemplateId()))
                .count();
        if (active > 0) {
            throw new TemplateInUseException(templateId, active);
        }
    }
}
