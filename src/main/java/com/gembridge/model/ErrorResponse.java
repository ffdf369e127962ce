package com.gembridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gembridge.exception.GatewayException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * OpenAI-style error body: {@code {"error": {"message", "type", "code"}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    @JsonProperty("error")
    private ErrorDetail error;

    public static ErrorResponse of(String message, String type, int code) {
        return new ErrorResponse(ErrorDetail.builder()
                .message(message)
                .type(type)
                .code(code)
                .build());
    }

    /**
     * Error body for any failure: gateway failures carry their own type and status,
     * rejected input is a 400 and everything else a 500.
     */
    public static ErrorResponse from(Throwable error) {
        HttpStatus status = statusOf(error);
        String type;
        if (error instanceof GatewayException) {
            type = ((GatewayException) error).getErrorType();
        } else if (error instanceof IllegalArgumentException) {
            type = "invalid_request_error";
        } else {
            type = "api_error";
        }
        String message = error.getMessage() != null ? error.getMessage() : status.getReasonPhrase();
        return of(message, type, status.value());
    }

    public static HttpStatus statusOf(Throwable error) {
        if (error instanceof GatewayException) {
            return ((GatewayException) error).getStatus();
        }
        if (error instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {

        @JsonProperty("message")
        private String message;

        @JsonProperty("type")
        private String type;

        @JsonProperty("code")
        private Integer code;
    }
}
