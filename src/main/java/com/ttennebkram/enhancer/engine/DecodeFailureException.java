package com.ttennebkram.enhancer.engine;

/**
 * Input bytes could not be decoded into a raster image.
 */
public class DecodeFailureException extends EnhancementException {

    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
