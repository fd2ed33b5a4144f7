package com.infergate.handler;

import com.infergate.config.InfergateProperties;
import com.infergate.exception.ModelLoadException;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Closed set of handler kinds that configuration may reference.
 *
 * An unknown tag fails startup instead of surfacing later as a runtime error.
 */
public enum HandlerKind {

    /**
     * Deterministic feature hashing, no model files.
     */
    HASHING("hashing", HashingEmbeddingHandler::new),

    /**
     * Sentence encoder exported to ONNX, run with ONNX Runtime.
     */
    ONNX("onnx", OnnxEmbeddingHandler::new);

    private final String tag;
    private final BiFunction<InfergateProperties.ModelConfig, String, EmbeddingHandler> factory;

    HandlerKind(String tag, BiFunction<InfergateProperties.ModelConfig, String, EmbeddingHandler> factory) {
        this.tag = tag;
        this.factory = factory;
    }

    public String getTag() {
        return tag;
    }

    public EmbeddingHandler create(InfergateProperties.ModelConfig config, String device) {
        return factory.apply(config, device);
    }

    public static HandlerKind fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ModelLoadException("Model kind must be specified");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (HandlerKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        throw new ModelLoadException("Unknown model kind '" + tag + "'. Known kinds: "
                + Arrays.stream(values()).map(HandlerKind::getTag).collect(Collectors.joining(", ")));
    }
}
