package com.ttennebkram.enhancer.engine;

/**
 * Base class for every failure an enhancement call can report.
 * Failures are local to one call; the caller's image is never left half-written.
 */
public abstract class EnhancementException extends Exception {

    protected EnhancementException(String message) {
        super(message);
    }

    protected EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
