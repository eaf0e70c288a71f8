package com.dataPlatform.platformFacade.gateway.controller;

import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.error.ClassifiedError;
import com.dataPlatform.platformFacade.facade.error.ErrorClassifier;
import com.dataPlatform.platformFacade.facade.error.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the HTTP adapter.
 *
 * Facade operations never throw, so this only sees binding failures and bugs in the
 * adapter itself. Both are answered with the same envelope the operations use.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorClassifier errorClassifier;

    /**
     * Query parameters that cannot be bound, e.g. {@code page=abc}.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<OperationResponse> handleBindException(BindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": invalid value '" + error.getRejectedValue() + "'")
                .findFirst()
                .orElse("Invalid request parameters");

        log.warn("Validation error: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(OperationResponse.error(ErrorKind.VALIDATION, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<OperationResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(OperationResponse.error(ErrorKind.VALIDATION, "Request body is missing or malformed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<OperationResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        ClassifiedError error = errorClassifier.classify(ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(OperationResponse.error(error.kind(), error.message()));
    }
}
