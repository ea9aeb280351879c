package com.ttennebkram.enhancer.engine;

/**
 * The requested operation name has no catalog entry.
 */
public class UnknownOperationException extends EnhancementException {

    private final String operation;

    public UnknownOperationException(String operation) {
        super("Unknown enhancement operation: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
