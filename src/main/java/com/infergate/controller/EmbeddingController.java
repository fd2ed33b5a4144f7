package com.infergate.controller;

import com.infergate.model.EmbeddingRequest;
import com.infergate.model.EmbeddingResponse;
import com.infergate.service.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * OpenAI-compatible embeddings endpoint.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class EmbeddingController {

    private final EmbeddingService embeddingService;

    public EmbeddingController(EmbeddingService embeddingService) {
        this.embeddingService = embeddingService;
    }

    /**
     * Create embeddings for a string or a list of strings.
     * Admission and batching errors are mapped by {@link ApiExceptionHandler}.
     */
    @PostMapping(value = "/embeddings",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<EmbeddingResponse>> createEmbeddings(@RequestBody EmbeddingRequest request) {
        log.debug("Received embedding request for model: {}", request.getModel());

        return embeddingService.createEmbeddings(request)
                .map(ResponseEntity::ok);
    }
}
