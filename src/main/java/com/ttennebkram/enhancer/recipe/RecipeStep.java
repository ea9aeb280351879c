package com.ttennebkram.enhancer.recipe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One operation of a recipe with its raw parameters.
 */
public final class RecipeStep {

    private final String operation;
    private final Map<String, String> params;

    public RecipeStep(String operation, Map<String, String> params) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public RecipeStep(String operation) {
        this(operation, Collections.emptyMap());
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, String> getParams() {
        return params;
    }

    @Override
    public String toString() {
        return operation + params;
    }
}
