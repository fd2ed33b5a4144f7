package com.infergate.handler;

import com.infergate.config.InfergateProperties;
import com.infergate.exception.ModelLoadException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic feature-hashing embedder. Needs no model files, so it serves local
 * development, smoke tests and capacity tuning of the gateway itself.
 *
 * Algorithm:
 * 1. Normalize and split into word tokens plus character trigrams
 * 2. Hash each token to a dimension and a sign
 * 3. Accumulate weighted contributions (stop words count less)
 * 4. L2 normalize
 *
 * Similar texts land close together; identical texts always produce identical vectors.
 */
@Slf4j
public class HashingEmbeddingHandler extends AbstractEmbeddingHandler {

    private static final int NGRAM_SIZE = 3;
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "be", "this", "that"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int dimensions;

    public HashingEmbeddingHandler(InfergateProperties.ModelConfig config, String device) {
        super(config, device, false);
        if (config.getDimensions() <= 0) {
            throw new ModelLoadException("dimensions must be > 0 for model " + config.getName());
        }
        this.dimensions = config.getDimensions();
        log.info("Loaded hashing embedder '{}' ({} dimensions)", config.getName(), dimensions);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    protected List<float[]> embedChunk(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    @Override
    protected int countTokens(String text) {
        String normalized = normalizeText(text);
        return normalized.isEmpty() ? 0 : WHITESPACE.split(normalized).length;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimensions];
        String normalized = normalizeText(text);
        if (normalized.isEmpty()) {
            return vector;
        }

        for (String word : WHITESPACE.split(normalized)) {
            accumulate(vector, "w:" + word, weightOf(word));
        }
        for (int i = 0; i + NGRAM_SIZE <= normalized.length(); i++) {
            accumulate(vector, "g:" + normalized.substring(i, i + NGRAM_SIZE), 1.0f);
        }

        return normalize(vector);
    }

    private void accumulate(float[] vector, String token, float weight) {
        long hash = hash64(token);
        int index = (int) Long.remainderUnsigned(hash, dimensions);
        float sign = (hash >>> 63) == 0 ? 1.0f : -1.0f;
        vector[index] += sign * weight;
    }

    private static float weightOf(String word) {
        float weight = STOP_WORDS.contains(word) ? 0.5f : 2.0f;
        if (word.length() > 8) {
            weight += 0.5f;
        }
        return weight;
    }

    private static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase()).replaceAll(" ").trim();
    }

    /**
     * FNV-1a followed by a murmur finalizer for better bit spread.
     */
    private static long hash64(String token) {
        long h = FNV_OFFSET;
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            h ^= b & 0xff;
            h *= FNV_PRIME;
        }
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return h;
    }
}
