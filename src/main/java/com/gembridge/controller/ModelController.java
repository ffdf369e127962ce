package com.gembridge.controller;

import com.gembridge.model.ModelList;
import com.gembridge.service.translation.ModelCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * OpenAI-compatible model listing.
 */
@RestController
@RequestMapping("/v1")
public class ModelController {

    private final ModelCatalog modelCatalog;
    private final Clock clock;

    public ModelController(ModelCatalog modelCatalog, Clock clock) {
        this.modelCatalog = modelCatalog;
        this.clock = clock;
    }

    @GetMapping("/models")
    public ModelList listModels() {
        long created = clock.instant().getEpochSecond();
        return new ModelList(modelCatalog.listModelIds().stream()
                .map(id -> ModelList.ModelEntry.builder()
                        .id(id)
                        .created(created)
                        .build())
                .toList());
    }
}
