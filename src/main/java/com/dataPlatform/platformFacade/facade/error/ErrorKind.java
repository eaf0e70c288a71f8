package com.dataPlatform.platformFacade.facade.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable failure categories reported to callers as {@code error_type}.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    /** Bad caller input, detected before any upstream call. */
    VALIDATION("validation_error"),
    AUTHENTICATION("authentication_error"),
    PERMISSION("permission_error"),
    NOT_FOUND("not_found_error"),
    RATE_LIMIT("rate_limit_error"),
    TIMEOUT("timeout_error"),
    UNKNOWN("unknown_error");

    private final String code;
}
