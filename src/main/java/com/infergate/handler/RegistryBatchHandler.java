package com.infergate.handler;

import com.infergate.batching.BatchHandler;
import com.infergate.concurrency.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Routes batches to the registered handler for the batch's model.
 */
@Slf4j
public class RegistryBatchHandler implements BatchHandler<String, float[]> {

    private final ModelRegistry registry;

    public RegistryBatchHandler(ModelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public List<float[]> process(String model, List<String> inputs, CancellationToken token) {
        return registry.get(model).embed(inputs, token);
    }

    @Override
    public String device(String model) {
        return registry.find(model).map(EmbeddingHandler::device).orElse("unknown");
    }

    @Override
    public void onFailure(String model, Throwable error) {
        registry.find(model).ifPresent(handler -> {
            log.debug("Releasing cached resources of model '{}' after failure", model);
            handler.releaseResources();
        });
    }
}
