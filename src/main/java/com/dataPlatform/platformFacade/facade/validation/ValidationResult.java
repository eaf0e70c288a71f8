package com.dataPlatform.platformFacade.facade.validation;

/**
 * Outcome of a parameter check. {@code message} is null when valid.
 */
public record ValidationResult(boolean valid, String message) {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(false, message);
    }
}
