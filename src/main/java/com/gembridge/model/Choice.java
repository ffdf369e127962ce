package com.gembridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Choice in chat completion response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Choice {

    @JsonProperty("index")
    private Integer index;

    @JsonProperty("message")
    private Message message;

    @JsonProperty("finish_reason")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String finishReason; // stop, length, content_filter, null
}
