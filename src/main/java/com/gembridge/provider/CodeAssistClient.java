package com.gembridge.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.RateLimitException;
import com.gembridge.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP calls against the Code Assist {@code v1internal} API.
 * <p>
 * Generate calls are wrapped in the {@code {model, project, request}} envelope and the
 * {@code response} member of each reply is unwrapped. A 429 becomes {@link RateLimitException}
 * and any other error status an {@link UpstreamException}. The onboarding calls leave HTTP
 * errors as {@link org.springframework.web.reactive.function.client.WebClientResponseException}
 * for the caller to map.
 */
@Slf4j
@Component
public class CodeAssistClient {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ClientMetadata clientMetadata;
    private final String baseUrl;

    public CodeAssistClient(WebClient webClient,
                            ObjectMapper objectMapper,
                            ClientMetadata clientMetadata,
                            GembridgeProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clientMetadata = clientMetadata;
        GembridgeProperties.UpstreamConfig upstream = properties.getUpstream();
        this.baseUrl = stripTrailingSlash(upstream.getEndpoint()) + "/" + upstream.getApiVersion();
    }

    /**
     * Ask Code Assist for the caller's tier and project.
     *
     * @param projectId project to check, or null to let Code Assist report the caller's default
     */
    public Mono<JsonNode> loadCodeAssist(String accessToken, String projectId) {
        ObjectNode body = objectMapper.createObjectNode();
        if (projectId != null) {
            body.put("cloudaicompanionProject", projectId);
        }
        body.set("metadata", clientMetadata.metadata(projectId));
        return post("loadCodeAssist", accessToken, body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * Start or poll onboarding of a project onto a tier. The reply carries {@code done}.
     */
    public Mono<JsonNode> onboardUser(String accessToken, String tierId, String projectId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("tierId", tierId);
        if (projectId != null) {
            body.put("cloudaicompanionProject", projectId);
        }
        body.set("metadata", clientMetadata.metadata(projectId));
        return post("onboardUser", accessToken, body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * Non-streaming generation.
     *
     * @param model   upstream base model name
     * @param request Gemini request body
     * @return the unwrapped Gemini response
     */
    public Mono<JsonNode> generateContent(String accessToken, String projectId, String model, ObjectNode request) {
        return post("generateContent", accessToken, envelope(projectId, model, request))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toGenerateError)
                .bodyToMono(JsonNode.class)
                .map(this::unwrap);
    }

    /**
     * Streaming generation over server-sent events. Each emitted node is one unwrapped
     * Gemini response chunk.
     */
    public Flux<JsonNode> streamGenerateContent(String accessToken, String projectId, String model,
                                                ObjectNode request) {
        return webClient.post()
                .uri(baseUrl + ":streamGenerateContent?alt=sse")
                .headers(headers -> applyHeaders(headers, accessToken))
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(envelope(projectId, model, request))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toGenerateError)
                .bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .map(String::trim)
                .filter(data -> !data.isEmpty() && !"[DONE]".equals(data))
                .map(this::parseChunk)
                .map(this::unwrap);
    }

    private WebClient.RequestHeadersSpec<?> post(String method, String accessToken, ObjectNode body) {
        log.debug("Calling Code Assist {}", method);
        return webClient.post()
                .uri(baseUrl + ":" + method)
                .headers(headers -> applyHeaders(headers, accessToken))
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body);
    }

    private void applyHeaders(HttpHeaders headers, String accessToken) {
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, clientMetadata.userAgent());
    }

    private ObjectNode envelope(String projectId, String model, ObjectNode request) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("model", model);
        envelope.put("project", projectId);
        envelope.set("request", request);
        return envelope;
    }

    private Mono<? extends Throwable> toGenerateError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
                        return new RateLimitException(body);
                    }
                    log.warn("Code Assist returned {}: {}", status, body);
                    return new UpstreamException(status, body);
                });
    }

    private JsonNode parseChunk(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(HttpStatus.BAD_GATEWAY.value(), "Malformed stream chunk: " + data);
        }
    }

    private JsonNode unwrap(JsonNode reply) {
        JsonNode response = reply.get("response");
        return response != null && response.isObject() ? response : reply;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
