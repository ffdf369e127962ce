package com.gembridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Non-2xx reply from a Code Assist generate call, other than 429.
 */
@Getter
public class UpstreamException extends GatewayException {

    private final int upstreamStatus;
    private final String upstreamBody;

    public UpstreamException(int upstreamStatus, String upstreamBody) {
        super("Code Assist returned " + upstreamStatus + ": " + upstreamBody);
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }

    @Override
    public String getErrorType() {
        return "upstream_error";
    }

    @Override
    public HttpStatus getStatus() {
        HttpStatus resolved = HttpStatus.resolve(upstreamStatus);
        return resolved != null ? resolved : HttpStatus.BAD_GATEWAY;
    }
}
