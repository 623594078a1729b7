package com.example.environment_service.exception;

/**
 * Thrown when a template referenced by a live environment is edited or removed.
 */
public class TemplateInUseException extends EnvironmentException {

    public TemplateInUseException(String templateId, long activeEnvironments) {
        super(ErrorKind.TEMPLATE_IN_USE, templateId,
                "Template " + templateId + " is referenced by " + activeEnvironments + " active environment(s)");
    }
}
