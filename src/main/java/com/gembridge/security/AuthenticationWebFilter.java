package com.gembridge.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gembridge.exception.AuthenticationException;
import com.gembridge.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Requires the gateway password on every request except CORS preflights and the health probe.
 * Runs right after the CORS filter so rejected responses still carry CORS headers.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthenticationWebFilter implements WebFilter {

    static final String HEALTH_PATH = "/health";

    private final InboundAuthenticator authenticator;
    private final ObjectMapper objectMapper;

    public AuthenticationWebFilter(InboundAuthenticator authenticator, ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (isOpen(request)) {
            return chain.filter(exchange);
        }

        try {
            String principal = authenticator.authenticate(request.getHeaders(), request.getQueryParams());
            log.debug("Authenticated {} for {} {}", principal, request.getMethod(), request.getPath());
        } catch (AuthenticationException e) {
            log.warn("Rejected unauthenticated {} {}", request.getMethod(), request.getPath());
            return reject(exchange.getResponse(), e);
        }
        return chain.filter(exchange);
    }

    private boolean isOpen(ServerHttpRequest request) {
        if (HttpMethod.OPTIONS.equals(request.getMethod())) {
            return true;
        }
        return HttpMethod.GET.equals(request.getMethod())
                && HEALTH_PATH.equals(request.getPath().pathWithinApplication().value());
    }

    private Mono<Void> reject(ServerHttpResponse response, AuthenticationException error) {
        response.setStatusCode(error.getStatus());
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Basic");
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(
                    ErrorResponse.of(error.getMessage(), error.getErrorType(), error.getStatus().value()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize authentication error", e);
            body = error.getMessage().getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }
}
