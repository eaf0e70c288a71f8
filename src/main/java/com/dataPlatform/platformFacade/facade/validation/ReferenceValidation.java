package com.dataPlatform.platformFacade.facade.validation;

/**
 * Result of checking an "owner/name" reference. {@code ref} is set only when valid.
 */
public record ReferenceValidation(ValidationResult result, ResourceRef ref) {

    public static final String SEPARATOR = "/";

    static ReferenceValidation valid(String owner, String name) {
        return new ReferenceValidation(ValidationResult.ok(), new ResourceRef(owner, name));
    }

    static ReferenceValidation invalid(String message) {
        return new ReferenceValidation(ValidationResult.invalid(message), null);
    }

    public boolean isValid() {
        return result.valid();
    }
}
