package com.infergate.exception;

public class ModelNotFoundException extends InfergateException {

    private final String model;

    public ModelNotFoundException(String model) {
        super("Model " + model + " not found");
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
