package com.feedery.core.config;

/**
 * The source registry could not be loaded. Always fatal for a run.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
