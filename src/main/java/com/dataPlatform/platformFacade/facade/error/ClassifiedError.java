package com.dataPlatform.platformFacade.facade.error;

/**
 * An error kind together with the message shown to the caller.
 */
public record ClassifiedError(ErrorKind kind, String message) {
}
