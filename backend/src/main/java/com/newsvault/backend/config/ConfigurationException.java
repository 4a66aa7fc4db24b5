package com.newsvault.backend.config;

/**
 * A collaborator cannot be used because required configuration is missing or invalid.
 */
public class ConfigurationException extends RuntimeException {

    private final String dependency;

    public ConfigurationException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public ConfigurationException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
