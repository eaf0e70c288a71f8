package com.dataPlatform.platformFacade.facade.validation;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Checks request parameters before anything reaches the cache or the platform.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final FacadeSettings settings;

    /**
     * Validates pagination against the configured maximum page size.
     */
    public ValidationResult validatePagination(int page, int pageSize) {
        return validatePagination(page, pageSize, settings.getMaxPageSize());
    }

    /**
     * Validates pagination parameters.
     *
     * @param page Page number, 1-based
     * @param pageSize Items per page
     * @param maxPageSize Largest accepted page size
     * @return Validation result
     */
    public static ValidationResult validatePagination(int page, int pageSize, int maxPageSize) {
        if (page < 1) {
            return ValidationResult.invalid("Page number must be 1 or greater");
        }
        if (pageSize < 1) {
            return ValidationResult.invalid("Page size must be 1 or greater");
        }
        if (pageSize > maxPageSize) {
            return ValidationResult.invalid("Page size cannot exceed " + maxPageSize);
        }
        return ValidationResult.ok();
    }

    /**
     * Validates a dataset reference of the form "username/dataset-name".
     */
    public static ReferenceValidation validateDatasetRef(String datasetRef) {
        if (datasetRef == null || datasetRef.isBlank()) {
            return ReferenceValidation.invalid("Dataset reference cannot be empty");
        }
        if (!datasetRef.contains(ReferenceValidation.SEPARATOR)) {
            return ReferenceValidation.invalid("Dataset reference must be in format 'username/dataset-name'");
        }

        String[] parts = datasetRef.split(ReferenceValidation.SEPARATOR, -1);
        if (parts.length != 2) {
            return ReferenceValidation.invalid("Dataset reference must contain exactly one '/' separator");
        }
        if (parts[0].isEmpty() || parts[1].isEmpty()) {
            return ReferenceValidation.invalid("Both username and dataset name must be non-empty");
        }
        if (!isPathSegment(parts[0]) || !isPathSegment(parts[1])) {
            return ReferenceValidation.invalid("Username and dataset name cannot be '.' or '..' or contain '\\'");
        }
        return ReferenceValidation.valid(parts[0], parts[1]);
    }

    /**
     * Requires a non-blank identifier such as a competition id.
     *
     * @param value Identifier value
     * @param fieldName Name used in the message
     */
    public static ValidationResult requireIdentifier(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            return ValidationResult.invalid(fieldName + " cannot be empty");
        }
        return ValidationResult.ok();
    }

    /**
     * Requires a non-blank identifier that is also usable as a single directory name.
     *
     * @param value Identifier value
     * @param fieldName Name used in the message
     */
    public static ValidationResult requirePathSegment(String value, String fieldName) {
        ValidationResult present = requireIdentifier(value, fieldName);
        if (!present.valid()) {
            return present;
        }
        if (!isPathSegment(value)) {
            return ValidationResult.invalid(fieldName + " cannot be '.' or '..' or contain '/' or '\\'");
        }
        return ValidationResult.ok();
    }

    static boolean isPathSegment(String value) {
        return !value.equals(".") && !value.equals("..") && value.indexOf('/') < 0 && value.indexOf('\\') < 0;
    }
}
