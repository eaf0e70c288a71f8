package com.dataPlatform.platformFacade.platform.exception;

/**
 * Failure reported by the platform client.
 * The message keeps the upstream status text (e.g. "404 Not Found") for error classification.
 */
public class PlatformClientException extends RuntimeException {

    public PlatformClientException(String message) {
        super(message);
    }

    public PlatformClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
