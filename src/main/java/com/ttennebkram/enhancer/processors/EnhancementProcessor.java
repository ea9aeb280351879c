package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EngineConfig;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.ImageVariant;
import com.ttennebkram.enhancer.image.RasterImage;

import java.util.Set;

/**
 * One entry of the transform catalog.
 * Each processor encapsulates:
 * - Parameter coercion into its own typed parameter object
 * - Processing logic (OpenCV operations)
 * - Serialization of its parameters (JSON)
 *
 * Processors hold no per-call state, so one instance may serve concurrent calls.
 *
 * @param <P> the typed parameters of this operation
 */
public interface EnhancementProcessor<P> {

    /**
     * Operation name, e.g. "gamma_correction".
     */
    String getOperation();

    /**
     * Catalog category, e.g. "Tonal".
     */
    String getCategory();

    /**
     * Description for catalog listings, including the OpenCV calls involved.
     */
    String getDescription();

    /**
     * Variants the transform accepts without conversion.
     */
    Set<ImageVariant> getAcceptedVariants();

    /**
     * Apply engine-wide tuning values. Called once, before any call to process().
     */
    default void configure(EngineConfig config) {
        // Default: nothing to configure
    }

    /**
     * Coerce and validate raw parameters. Absent keys take the operation defaults.
     */
    P parseParameters(ParameterReader reader) throws InvalidParameterException;

    /**
     * Run the transform.
     *
     * @param input an image of one of the accepted variants (do not modify or release)
     * @param params parameters produced by {@link #parseParameters}
     * @return a result holding a newly allocated image, or a palette
     */
    EnhancementResult process(RasterImage input, P params);

    /**
     * Write the parameters to JSON using the same keys callers pass in.
     */
    void serializeParameters(P params, JsonObject json);
}
