package com.gembridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible model listing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelList {

    @JsonProperty("object")
    private String object = "list";

    @JsonProperty("data")
    private List<ModelEntry> data;

    public ModelList(List<ModelEntry> data) {
        this.data = data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelEntry {

        @JsonProperty("id")
        private String id;

        @JsonProperty("object")
        @Builder.Default
        private String object = "model";

        @JsonProperty("created")
        private Long created;

        @JsonProperty("owned_by")
        @Builder.Default
        private String ownedBy = "google";
    }
}
