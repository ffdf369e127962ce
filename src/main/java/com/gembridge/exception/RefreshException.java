package com.gembridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * The refresh-token exchange failed. The stored record is left as it was.
 */
@Getter
public class RefreshException extends GatewayException {

    private final String identity;

    public RefreshException(String identity, String message, Throwable cause) {
        super("Failed to refresh credential " + identity + ": " + message, cause);
        this.identity = identity;
    }

    public RefreshException(String identity, String message) {
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
