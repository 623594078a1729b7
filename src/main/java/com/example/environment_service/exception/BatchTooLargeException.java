package com.example.environment_service.exception;

/**
 * Thrown when a batch job asks for more items than the hard ceiling allows.
 * The whole job is rejected before any item starts.
 */
public class BatchTooLargeException extends EnvironmentException {

    public BatchTooLargeException(String namePrefix, int requested, int ceiling) {
        super(ErrorKind.BATCH_TOO_LARGE, namePrefix,
                "Batch of " + requested + " items exceeds the ceiling of " + ceiling);
    }
}
