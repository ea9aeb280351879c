package com.ttennebkram.enhancer.recipe;

import com.ttennebkram.enhancer.engine.EnhancementEngine;
import com.ttennebkram.enhancer.engine.EnhancementException;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.ProcessingFailureException;
import com.ttennebkram.enhancer.image.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a recipe by feeding each step's output image into the next step.
 */
public class RecipeRunner {

    private static final Logger logger = LoggerFactory.getLogger(RecipeRunner.class);

    private final EnhancementEngine engine;

    public RecipeRunner(EnhancementEngine engine) {
        this.engine = engine;
    }

    /**
     * Check the whole recipe, then run it. The input image is never modified;
     * intermediate images are released as soon as the next step has consumed them.
     *
     * @return the last step's result, or the input itself for an empty recipe
     */
    public EnhancementResult run(Recipe recipe, RasterImage input) throws EnhancementException {
        validate(recipe);
        if (recipe.isEmpty()) {
            return EnhancementResult.ofImage("recipe:" + recipe.getName(), input);
        }

        List<RecipeStep> steps = recipe.getSteps();
        RasterImage current = input;
        EnhancementResult result = null;
        for (int i = 0; i < steps.size(); i++) {
            RecipeStep step = steps.get(i);
            try {
                result = engine.apply(step.getOperation(), current, step.getParams());
            } catch (EnhancementException e) {
                logger.warn("Recipe '{}' failed at step {} ({}): {}", recipe.getName(), i, step.getOperation(), e.getMessage());
                if (current != input) current.release();
                throw e;
            }
            if (current != input) {
                current.release();
            }
            if (result.isImage()) {
                current = result.image();
            }
        }
        return result;
    }

    /**
     * Every operation must exist, and a palette step may only come last.
     */
    public void validate(Recipe recipe) throws EnhancementException {
        List<RecipeStep> steps = recipe.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            String operation = steps.get(i).getOperation();
            boolean palette = engine.describe(operation).producesPalette();
            if (palette && i < steps.size() - 1) {
                throw new ProcessingFailureException(operation,
                        "step " + i + " produces a palette and cannot feed step " + (i + 1));
            }
        }
    }
}
