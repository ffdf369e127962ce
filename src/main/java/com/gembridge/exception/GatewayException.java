package com.gembridge.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures raised by the gateway core.
 * Carries the OpenAI error type and the HTTP status used when the failure reaches a client.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * OpenAI-style error type, e.g. "authentication_error".
     */
    public abstract String getErrorType();

    public abstract HttpStatus getStatus();
}
