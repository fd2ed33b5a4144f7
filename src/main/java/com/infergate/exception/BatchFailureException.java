package com.infergate.exception;

/**
 * The model invocation serving a dispatched batch failed. Every caller whose items were
 * part of that batch receives the same instance.
 */
public class BatchFailureException extends InfergateException {

    private final String model;
    private final int batchSize;
    private final String device;

    public BatchFailureException(String model, int batchSize, String device, Throwable cause) {
        super("Batch of " + batchSize + " item(s) failed for model '" + model + "' on " + device, cause);
        this.model = model;
        this.batchSize = batchSize;
        this.device = device;
    }

    public BatchFailureException(String model, int batchSize, String device, String reason) {
        super("Batch of " + batchSize + " item(s) failed for model '" + model + "' on " + device + ": " + reason);
        this.model = model;
        this.batchSize = batchSize;
        this.device = device;
    }

    public String getModel() {
        return model;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public String getDevice() {
        return device;
    }
}
