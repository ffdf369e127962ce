package com.gembridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for calls to Code Assist and the OAuth token endpoint.
 */
@Configuration
public class WebClientConfiguration {

    // Gemini replies with inline images or long reasoning exceed the 256KB codec default
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    private final GembridgeProperties properties;

    public WebClientConfiguration(GembridgeProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getUpstream().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build();
    }
}
