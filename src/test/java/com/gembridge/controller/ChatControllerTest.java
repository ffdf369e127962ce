package com.gembridge.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.RateLimitException;
import com.gembridge.model.ChatCompletionChunk;
import com.gembridge.model.ChatCompletionResponse;
import com.gembridge.model.Choice;
import com.gembridge.model.Delta;
import com.gembridge.model.Message;
import com.gembridge.security.AuthenticationWebFilter;
import com.gembridge.security.InboundAuthenticator;
import com.gembridge.service.ProviderService;
import com.gembridge.service.StreamingService;
import com.gembridge.service.translation.ModelCatalog;
import com.gembridge.support.MutableClock;
import com.gembridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * HTTP surface: authentication, validation, JSON and SSE responses.
 */
class ChatControllerTest {

    private static final String PASSWORD = "s3cret";
    private static final String BODY = "{\"model\":\"gemini-2.5-pro\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}";
    private static final String STREAM_BODY =
            "{\"model\":\"gemini-2.5-pro\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}";

    private ProviderService providerService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        GembridgeProperties properties = TestProperties.defaults();
        properties.getAuth().setPassword(PASSWORD);
        providerService = mock(ProviderService.class);

        client = WebTestClient.bindToController(
                        new ChatController(providerService, new StreamingService(objectMapper)),
                        new ModelController(new ModelCatalog(properties),
                                new MutableClock(Instant.parse("2025-01-01T00:00:00Z"))),
                        new HealthController())
                .controllerAdvice(new GatewayExceptionHandler())
                .webFilter(new AuthenticationWebFilter(new InboundAuthenticator(properties), objectMapper))
                .build();
    }

    @Test
    void testMissingCredentialsAreRejected() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectHeader().valueEquals(HttpHeaders.WWW_AUTHENTICATE, "Basic")
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("authentication_error");

        verifyNoInteractions(providerService);
    }

    @Test
    void testHealthIsOpen() {
        client.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.service").isEqualTo("gembridge");
    }

    @Test
    void testModelsListing() {
        client.get().uri("/v1/models?key=" + PASSWORD)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data[0].id").isEqualTo("gemini-2.5-pro")
                .jsonPath("$.data[1].id").isEqualTo("gemini-2.5-pro-search")
                .jsonPath("$.data[0].created").isEqualTo(1735689600);
    }

    @Test
    void testEmptyMessagesIsBadRequest() {
        client.post().uri("/v1/chat/completions")
                .headers(headers -> headers.setBearerAuth(PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gemini-2.5-pro\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.code").isEqualTo(400);
    }

    @Test
    void testCompletionAsJson() {
        when(providerService.forward(any())).thenReturn(Mono.just(ChatCompletionResponse.builder()
                .id("chatcmpl-1")
                .object(ChatCompletionResponse.OBJECT_TYPE)
                .model("gemini-2.5-pro")
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(Message.builder().role("assistant").content("hello").build())
                        .finishReason("stop")
                        .build()))
                .build()));

        client.post().uri("/v1/chat/completions")
                .headers(headers -> headers.set("x-goog-api-key", PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("chat.completion")
                .jsonPath("$.choices[0].message.content").isEqualTo("hello")
                .jsonPath("$.choices[0].finish_reason").isEqualTo("stop");
    }

    @Test
    void testUpstreamRateLimitSurfacesAs429() {
        when(providerService.forward(any())).thenReturn(Mono.error(new RateLimitException("{}")));

        client.post().uri("/v1/chat/completions")
                .headers(headers -> headers.setBearerAuth(PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("rate_limit_exceeded");
    }

    @Test
    void testStreamingEndsWithDone() {
        when(providerService.stream(any())).thenReturn(Flux.just(ChatCompletionChunk.builder()
                .id("chatcmpl-1")
                .object(ChatCompletionChunk.OBJECT_TYPE)
                .model("gemini-2.5-pro")
                .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                        .index(0)
                        .delta(Delta.builder().content("hel").build())
                        .build()))
                .build()));

        String body = client.post().uri("/v1/chat/completions")
                .headers(headers -> headers.setBearerAuth(PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(STREAM_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        assertTrue(body.contains("\"content\":\"hel\""));
        assertTrue(body.indexOf("chat.completion.chunk") < body.indexOf("[DONE]"));
        assertTrue(body.trim().endsWith("[DONE]"));
    }

    @Test
    void testStreamingFailureIsSentAsEvent() {
        when(providerService.stream(any())).thenReturn(Flux.error(new RateLimitException("{}")));

        String body = client.post().uri("/v1/chat/completions")
                .headers(headers -> headers.setBearerAuth(PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(STREAM_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        assertTrue(body.contains("rate_limit_exceeded"));
        assertTrue(body.trim().endsWith("[DONE]"));
    }

    @Test
    void testUnsupportedStreamingModelIsBadRequest() {
        when(providerService.stream(any())).thenThrow(new IllegalArgumentException("Unsupported model: gpt-4"));

        client.post().uri("/v1/chat/completions")
                .headers(headers -> headers.setBearerAuth(PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("Unsupported model: gpt-4");
    }
}
