package com.gembridge.controller;

import com.gembridge.exception.AuthenticationException;
import com.gembridge.exception.ConfigurationException;
import com.gembridge.exception.GatewayException;
import com.gembridge.exception.ProjectDiscoveryException;
import com.gembridge.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Renders failures as OpenAI error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException e) {
        if (e instanceof ProjectDiscoveryException || e instanceof ConfigurationException) {
            log.error("Configuration problem: {}", e.getMessage());
        } else {
            log.warn("Request failed with {}: {}", e.getStatus().value(), e.getMessage());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.status(e.getStatus());
        if (e instanceof AuthenticationException) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Basic");
        }
        return response.body(ErrorResponse.from(e));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.from(e));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException e) {
        log.warn("Unreadable request body: {}", e.getReason());
        String message = e.getReason() != null ? e.getReason() : "Invalid request body";
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(message, "invalid_request_error", HttpStatus.BAD_REQUEST.value()));
    }
}
