package com.gembridge.exception;

import org.springframework.http.HttpStatus;

/**
 * The account's tier needs an explicitly configured project. Not retriable.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
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
