package com.gembridge.exception;

import org.springframework.http.HttpStatus;

/**
 * No project id could be determined for a credential. Requires operator action.
 */
public class ProjectDiscoveryException extends GatewayException {

    public ProjectDiscoveryException(String message) {
        super(message);
    }

    public ProjectDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "configuration_error";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
