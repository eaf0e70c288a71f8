package com.dataPlatform.platformFacade.facade.dto;

import com.dataPlatform.platformFacade.facade.error.ErrorKind;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope returned by every facade operation.
 *
 * Success serializes as {@code {"status": "success", ...payload fields}};
 * error as {@code {"error": "...", "error_type": "..."}}.
 * Exactly one of payload and error is present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "error", "error_type"})
public final class OperationResponse {

    public static final String STATUS_SUCCESS = "success";

    private final Map<String, Object> payload;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private OperationResponse(Map<String, Object> payload, ErrorKind errorKind, String errorMessage) {
        this.payload = payload;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static OperationResponse success(Map<String, Object> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return new OperationResponse(Collections.unmodifiableMap(payload), null, null);
    }

    public static OperationResponse error(ErrorKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        return new OperationResponse(null, kind, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return payload != null;
    }

    @JsonProperty("status")
    public String getStatus() {
        return isSuccess() ? STATUS_SUCCESS : null;
    }

    /**
     * Payload fields, empty for an error envelope.
     */
    @JsonAnyGetter
    public Map<String, Object> getPayload() {
        return payload != null ? payload : Map.of();
    }

    @JsonProperty("error")
    public String getError() {
        return errorMessage;
    }

    @JsonProperty("error_type")
    public String getErrorType() {
        return errorKind != null ? errorKind.getCode() : null;
    }

    @JsonIgnore
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "OperationResponse(success, fields=" + payload.keySet() + ")"
                : "OperationResponse(error, kind=" + errorKind + ", message=" + errorMessage + ")";
    }
}
