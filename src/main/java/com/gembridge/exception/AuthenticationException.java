package com.gembridge.exception;

import org.springframework.http.HttpStatus;

/**
 * Inbound request carried no valid gateway password.
 */
public class AuthenticationException extends GatewayException {

    public AuthenticationException(String message) {
        super(message);
    }

    @Override
    public String getErrorType() {
        return "authentication_error";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNAUTHORIZED;
    }
}
