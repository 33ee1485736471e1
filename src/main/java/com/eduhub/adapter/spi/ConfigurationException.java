package com.eduhub.adapter.spi;

/**
 * Exception thrown when configuration or a configuration file is invalid.
 */
public class ConfigurationException extends EduHubException {

    private final ValidationResult validationResult;

    public ConfigurationException(String message) {
        super(message);
        this.validationResult = ValidationResult.failure("config", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.validationResult = ValidationResult.failure("config", message);
    }

    public ConfigurationException(ValidationResult validationResult) {
        super("Configuration validation failed: " + validationResult.allErrorMessages());
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
