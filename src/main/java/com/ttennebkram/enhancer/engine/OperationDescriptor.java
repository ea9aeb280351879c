package com.ttennebkram.enhancer.engine;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.image.ImageVariant;

import java.util.Set;

/**
 * Catalog listing entry for one operation.
 */
public final class OperationDescriptor {

    private final String operation;
    private final String category;
    private final String description;
    private final Set<ImageVariant> acceptedVariants;
    private final boolean producesPalette;
    private final JsonObject defaults;

    public OperationDescriptor(String operation, String category, String description,
                               Set<ImageVariant> acceptedVariants, boolean producesPalette, JsonObject defaults) {
        this.operation = operation;
        this.category = category;
        this.description = description;
        this.acceptedVariants = acceptedVariants;
        this.producesPalette = producesPalette;
        this.defaults = defaults;
    }

    public String getOperation() {
        return operation;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public Set<ImageVariant> getAcceptedVariants() {
        return acceptedVariants;
    }

    public boolean producesPalette() {
        return producesPalette;
    }

    /** Default parameter values, keyed as callers pass them. */
    public JsonObject getDefaults() {
        return defaults.deepCopy();
    }

    @Override
    public String toString() {
        return operation + " [" + category + "] " + defaults;
    }
}
