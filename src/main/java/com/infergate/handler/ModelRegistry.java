package com.infergate.handler;

import com.infergate.config.InfergateProperties;
import com.infergate.exception.ModelLoadException;
import com.infergate.exception.ModelNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loaded embedding handlers keyed by model name, built once at startup.
 *
 * Startup fails when:
 * - no models are configured
 * - a model references an unknown kind or cannot be loaded
 * - two models share a name
 * - the allow-list names a model that is not configured
 */
@Slf4j
public class ModelRegistry implements AutoCloseable {

    private final Map<String, EmbeddingHandler> handlers;

    ModelRegistry(Map<String, EmbeddingHandler> handlers) {
        this.handlers = handlers;
    }

    public static ModelRegistry load(List<InfergateProperties.ModelConfig> models,
                                     Collection<String> allowedModels,
                                     String device) {
        if (models == null || models.isEmpty()) {
            throw new ModelLoadException("No models configured");
        }

        Set<String> requested = new LinkedHashSet<>();
        if (allowedModels != null) {
            for (String name : allowedModels) {
                if (name != null && !name.isBlank()) {
                    requested.add(name.trim());
                }
            }
        }

        Map<String, EmbeddingHandler> loaded = new LinkedHashMap<>();
        try {
            for (InfergateProperties.ModelConfig model : models) {
                String name = model.getName();
                if (!requested.isEmpty() && !requested.contains(name)) {
                    continue;
                }
                if (loaded.containsKey(name)) {
                    throw new ModelLoadException("Model '" + name + "' configured more than once");
                }
                HandlerKind kind = HandlerKind.fromTag(model.getKind());
                EmbeddingHandler handler = kind.create(model, device);
                loaded.put(name, handler);
                log.info("Registered model '{}' (kind={}, dimensions={}, device={}, exclusive={})",
                        name, kind.getTag(), handler.dimensions(), handler.device(), handler.requiresExclusiveAccess());
            }

            Set<String> missing = new TreeSet<>(requested);
            missing.removeAll(loaded.keySet());
            if (!missing.isEmpty()) {
                throw new ModelLoadException("Requested model(s) not found in config: " + String.join(", ", missing));
            }
        } catch (RuntimeException e) {
            loaded.values().forEach(ModelRegistry::closeQuietly);
            throw e;
        }

        if (loaded.isEmpty()) {
            throw new ModelLoadException("No models loaded");
        }
        return new ModelRegistry(loaded);
    }

    public static ModelRegistry of(EmbeddingHandler... handlers) {
        Map<String, EmbeddingHandler> map = new LinkedHashMap<>();
        for (EmbeddingHandler handler : handlers) {
            map.put(handler.name(), handler);
        }
        return new ModelRegistry(map);
    }

    public EmbeddingHandler get(String name) {
        EmbeddingHandler handler = handlers.get(name);
        if (handler == null) {
            throw new ModelNotFoundException(name);
        }
        return handler;
    }

    public Optional<EmbeddingHandler> find(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public List<String> listModels() {
        return new ArrayList<>(handlers.keySet());
    }

    public Collection<EmbeddingHandler> handlers() {
        return handlers.values();
    }

    /**
     * Execution ceiling implied by the handlers: each exclusive handler can run one call
     * at a time, so a registry of only exclusive handlers gains nothing from more slots
     * than it has handlers.
     */
    public int deriveMaxConcurrent(int availableProcessors) {
        boolean allExclusive = handlers.values().stream().allMatch(EmbeddingHandler::requiresExclusiveAccess);
        if (allExclusive) {
            return Math.max(1, handlers.size());
        }
        return Math.max(1, availableProcessors);
    }

    @Override
    public void close() {
        handlers.values().forEach(ModelRegistry::closeQuietly);
    }

    private static void closeQuietly(EmbeddingHandler handler) {
        try {
            handler.close();
        } catch (Exception e) {
            log.warn("Error closing model '{}'", handler.name(), e);
        }
    }
}
