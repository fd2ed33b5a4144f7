package com.infergate.controller;

import com.infergate.handler.EmbeddingHandler;
import com.infergate.handler.ModelRegistry;
import com.infergate.model.ModelInfo;
import com.infergate.model.ModelList;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@RestController
@RequestMapping("/v1")
public class ModelController {

    private final ModelRegistry registry;

    public ModelController(ModelRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/models")
    public Mono<ModelList> listModels() {
        List<ModelInfo> data = new ArrayList<>();
        for (EmbeddingHandler handler : registry.handlers()) {
            data.add(ModelInfo.builder()
                    .id(handler.name())
                    .embeddingDimensions(handler.dimensions())
                    .capabilities(new ArrayList<>(new TreeSet<>(handler.capabilities())))
                    .build());
        }
        return Mono.just(ModelList.builder().data(data).build());
    }
}
