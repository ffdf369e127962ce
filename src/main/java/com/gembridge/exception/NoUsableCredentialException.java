package com.gembridge.exception;

import org.springframework.http.HttpStatus;

/**
 * The pool is empty, every record failed to load, or every credential is cooling down.
 */
public class NoUsableCredentialException extends GatewayException {

    public NoUsableCredentialException(String message) {
        super(message);
    }

    @Override
    public String getErrorType() {
        return "service_unavailable";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
