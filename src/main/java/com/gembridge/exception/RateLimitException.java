package com.gembridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Code Assist answered 429 for a credential. Triggers cooldown and rotation.
 */
@Getter
public class RateLimitException extends GatewayException {

    private final String upstreamBody;

    public RateLimitException(String upstreamBody) {
        super("Rate limited by Code Assist");
        this.upstreamBody = upstreamBody;
    }

    @Override
    public String getErrorType() {
        return "rate_limit_exceeded";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.TOO_MANY_REQUESTS;
    }
}
