package com.gembridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat message model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    @JsonProperty("role")
    private String role; // system, user, assistant

    /**
     * A plain string, or a list of content parts ({@code {"type":"text",...}} /
     * {@code {"type":"image_url",...}}) as sent by multimodal clients.
     */
    @JsonProperty("content")
    private Object content;

    @JsonProperty("reasoning_content")
    private String reasoningContent;

    @JsonProperty("name")
    private String name;
}
