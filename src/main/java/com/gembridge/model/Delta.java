package com.gembridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delta object for streaming chat completion chunks.
 * Contains incremental content for the current message; empty fields are left out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Delta {

    @JsonProperty("content")
    private String content;

    @JsonProperty("reasoning_content")
    private String reasoningContent;
}
