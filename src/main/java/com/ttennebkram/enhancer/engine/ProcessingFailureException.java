package com.ttennebkram.enhancer.engine;

/**
 * A transform could not produce a result for the given image.
 */
public class ProcessingFailureException extends EnhancementException {

    private final String operation;

    public ProcessingFailureException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public ProcessingFailureException(String operation, Throwable cause) {
        super(operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
