package com.example.environment_service.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when some, but not all, manifests of an environment were created before a
 * later step failed. The created set has already been rolled back (best effort) when
 * this is raised; the original failure is kept as the cause.
 */
@Getter
public class PartialProvisioningException extends EnvironmentException {

    private final List<String> createdResources;
    private final List<String> rollbackFailures;

    public PartialProvisioningException(String identity, List<String> createdResources,
                                        List<String> rollbackFailures, EnvironmentException cause) {
        super(ErrorKind.PARTIAL_PROVISIONING, identity,
                "Provisioning failed after " + createdResources.size() + " resource(s) were created: "
                        + cause.getMessage(), cause);
        this.createdResources = List.copyOf(createdResources);
        this.rollbackFailures = List.copyOf(rollbackFailures);
    }

    /**
     * @return the classification of the failure that interrupted provisioning
     */
    public ErrorKind getCauseKind() {
        return ((EnvironmentException) getCause()).getErrorKind();
    }
}
