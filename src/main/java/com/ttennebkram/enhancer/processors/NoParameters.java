package com.ttennebkram.enhancer.processors;

/**
 * Parameter type for operations that take none.
 */
public final class NoParameters {

    public static final NoParameters INSTANCE = new NoParameters();

    private NoParameters() {
    }

    @Override
    public String toString() {
        return "{}";
    }
}
