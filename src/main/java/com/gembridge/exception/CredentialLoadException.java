package com.gembridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A stored credential could not be read or parsed. The credential is skipped.
 */
@Getter
public class CredentialLoadException extends GatewayException {

    private final String identity;

    public CredentialLoadException(String identity, String message, Throwable cause) {
        super("Failed to load credential " + identity + ": " + message, cause);
        this.identity = identity;
    }

    public CredentialLoadException(String identity, String message) {
        this(identity, message, null);
    }

    @Override
    public String getErrorType() {
        return "credential_error";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
