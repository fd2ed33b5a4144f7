package com.infergate.handler;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.ModelLoadException;
import lombok.extern.slf4j.Slf4j;

import java.nio.LongBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence encoder running on ONNX Runtime (e.g. e5-small-v2 exported to ONNX).
 *
 * Each chunk runs as one padded [batch, seq] inference followed by masked mean pooling
 * over last_hidden_state and L2 normalization.
 *
 * Options:
 * - max-length: tokens kept per text (default 512)
 * - vocab-size: ids are clamped below this (default 30522)
 * - intra-op-threads: ONNX intra-op threads (default 4)
 */
@Slf4j
public class OnnxEmbeddingHandler extends AbstractEmbeddingHandler {

    private final OrtEnvironment env;
    private final OrtSession session;
    private final int dimensions;
    private final int maxLength;
    private final int vocabSize;
    private final boolean needsTokenTypes;

    public OnnxEmbeddingHandler(InfergateProperties.ModelConfig config, String device) {
        super(config, device, false);
        if (config.getSource() == null || !Files.isRegularFile(Path.of(config.getSource()))) {
            throw new ModelLoadException("ONNX model file not found for '" + config.getName() + "': " + config.getSource());
        }
        this.dimensions = config.getDimensions();
        this.maxLength = intOption(config, "max-length", 512);
        this.vocabSize = intOption(config, "vocab-size", 30522);

        log.info("Initializing ONNX embedding model '{}' from {}", config.getName(), config.getSource());
        try {
            env = OrtEnvironment.getEnvironment();

            OrtSession.SessionOptions sessionOptions = new OrtSession.SessionOptions();
            sessionOptions.setIntraOpNumThreads(intOption(config, "intra-op-threads", 4));
            sessionOptions.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            session = env.createSession(config.getSource(), sessionOptions);
            needsTokenTypes = session.getInputNames().contains("token_type_ids");
            log.info("Model inputs: {}, outputs: {}", session.getInputNames(), session.getOutputNames());
        } catch (OrtException e) {
            throw new ModelLoadException("Failed to load ONNX model '" + config.getName() + "'", e);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    protected List<float[]> embedChunk(List<String> texts) throws OrtException {
        long startTime = System.nanoTime();

        List<long[]> tokenized = new ArrayList<>(texts.size());
        int seqLen = 1;
        for (String text : texts) {
            long[] ids = tokenize(text);
            tokenized.add(ids);
            seqLen = Math.max(seqLen, ids.length);
        }

        int batch = texts.size();
        long[] inputIds = new long[batch * seqLen];
        long[] attentionMask = new long[batch * seqLen];
        for (int b = 0; b < batch; b++) {
            long[] ids = tokenized.get(b);
            System.arraycopy(ids, 0, inputIds, b * seqLen, ids.length);
            for (int t = 0; t < ids.length; t++) {
                attentionMask[b * seqLen + t] = 1L;
            }
        }
        long[] shape = {batch, seqLen};

        Map<String, OnnxTensor> inputs = new HashMap<>();
        try {
            inputs.put("input_ids", OnnxTensor.createTensor(env, LongBuffer.wrap(inputIds), shape));
            inputs.put("attention_mask", OnnxTensor.createTensor(env, LongBuffer.wrap(attentionMask), shape));
            if (needsTokenTypes) {
                inputs.put("token_type_ids", OnnxTensor.createTensor(env, LongBuffer.wrap(new long[batch * seqLen]), shape));
            }

            try (OrtSession.Result result = session.run(inputs)) {
                float[][][] hidden = (float[][][]) result.get(0).getValue();
                List<float[]> vectors = new ArrayList<>(batch);
                for (int b = 0; b < batch; b++) {
                    vectors.add(normalize(meanPooling(hidden[b], attentionMask, b * seqLen)));
                }

                long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
                log.debug("ONNX chunk of {} text(s), seq {} took {}ms", batch, seqLen, elapsedMs);
                return vectors;
            }
        } finally {
            for (OnnxTensor tensor : inputs.values()) {
                tensor.close();
            }
        }
    }

    @Override
    protected int countTokens(String text) {
        return tokenize(text).length;
    }

    @Override
    public void close() {
        try {
            session.close();
            log.info("ONNX embedding model '{}' closed", name());
        } catch (OrtException e) {
            log.error("Error closing ONNX session for '{}'", name(), e);
        }
    }

    /**
     * Character-level ids clamped to the vocabulary.
     * TODO: replace with the model's WordPiece tokenizer so ids match the vocabulary.
     */
    private long[] tokenize(String text) {
        String normalized = text == null ? "" : text.toLowerCase().trim();
        int length = Math.min(normalized.length(), maxLength);
        long[] tokens = new long[length];
        for (int i = 0; i < length; i++) {
            tokens[i] = Math.min(normalized.charAt(i), vocabSize - 1);
        }
        return tokens;
    }

    /**
     * Mean over the positions where the attention mask is set.
     */
    private float[] meanPooling(float[][] hiddenStates, long[] attentionMask, int maskOffset) {
        int hidden = hiddenStates.length == 0 ? dimensions : hiddenStates[0].length;
        if (hidden != dimensions) {
            throw new IllegalStateException("Model '" + name() + "' produced " + hidden
                    + " dimensions, configured " + dimensions);
        }
        float[] pooled = new float[dimensions];
        int counted = 0;
        for (int t = 0; t < hiddenStates.length; t++) {
            if (attentionMask[maskOffset + t] == 1L) {
                for (int j = 0; j < dimensions; j++) {
                    pooled[j] += hiddenStates[t][j];
                }
                counted++;
            }
        }
        if (counted > 0) {
            for (int j = 0; j < dimensions; j++) {
                pooled[j] /= counted;
            }
        }
        return pooled;
    }

    private static int intOption(InfergateProperties.ModelConfig config, String key, int defaultValue) {
        String value = config.getOptions().get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ModelLoadException("Option " + key + " must be an integer for model " + config.getName(), e);
        }
    }
}
