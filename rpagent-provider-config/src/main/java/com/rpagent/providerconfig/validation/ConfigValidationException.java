package com.rpagent.providerconfig.validation;

/**
 * Thrown when a resource provider config payload is malformed or fails validation.
 * The message is the first error found; nothing has been applied.
 */
public final class ConfigValidationException extends RuntimeException {

    private final ValidationResult validationResult;

    public ConfigValidationException(ValidationResult validationResult) {
        super(validationResult != null && validationResult.firstError() != null
                ? validationResult.firstError() : "Config validation failed");
        this.validationResult = validationResult;
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
        this.validationResult = ValidationResult.failure(message);
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
