package com.ttennebkram.enhancer.recipe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, ordered chain of operations applied one after another.
 */
public final class Recipe {

    private final String name;
    private final List<RecipeStep> steps;

    public Recipe(String name, List<RecipeStep> steps) {
        this.name = name == null ? "" : name;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public String getName() {
        return name;
    }

    public List<RecipeStep> getSteps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    @Override
    public String toString() {
        return "Recipe[" + name + ", " + steps + "]";
    }
}
