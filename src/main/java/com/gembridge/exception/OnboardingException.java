package com.gembridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * The onboarding handshake failed against Code Assist.
 * {@code upstreamStatus} is 0 when the failure was not an HTTP error.
 */
@Getter
public class OnboardingException extends GatewayException {

    private final int upstreamStatus;
    private final String upstreamBody;

    public OnboardingException(String message, int upstreamStatus, String upstreamBody, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }

    public OnboardingException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    @Override
    public String getErrorType() {
        return "onboarding_error";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }
}
