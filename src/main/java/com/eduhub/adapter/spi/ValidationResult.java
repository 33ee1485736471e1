package com.eduhub.adapter.spi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a configuration.
 */
public record ValidationResult(List<ValidationError> errors) {

    public ValidationResult {
        Objects.requireNonNull(errors, "errors must not be null");
        errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of());
    }

    public static ValidationResult failure(List<ValidationError> errors) {
        return new ValidationResult(errors);
    }

    public static ValidationResult failure(String field, String message) {
        return new ValidationResult(List.of(new ValidationError(field, message)));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isInvalid() {
        return !errors.isEmpty();
    }

    public String firstErrorMessage() {
        return errors.isEmpty() ? "" : errors.get(0).message();
    }

    public String allErrorMessages() {
        return errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }

    /**
     * A single invalid field.
     */
    public record ValidationError(String field, String message) {
        public ValidationError {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
