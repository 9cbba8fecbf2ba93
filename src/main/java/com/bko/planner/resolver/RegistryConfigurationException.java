package com.bko.planner.resolver;

public class RegistryConfigurationException extends RuntimeException {

    public RegistryConfigurationException(String message) {
        super(message);
    }

    public RegistryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
