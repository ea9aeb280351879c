package com.ttennebkram.enhancer.recipe;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipeSerializerTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsMixedValueTypes() {
        String json = "{\"name\": \"xray\", \"steps\": ["
                + "{\"operation\": \"clahe_enhance\", \"params\": {\"clip_limit\": 3.0, \"grid_size\": \"4\"}},"
                + "{\"operation\": \"gray_level_slicing\", \"params\": {\"highlight_only\": true, \"max_val\": null}},"
                + "{\"operation\": \"piecewise_linear_transform\", \"params\": {\"points\": [[0, 0], [255, 128]]}},"
                + "{\"operation\": \"sharpen\"}]}";

        Recipe recipe = RecipeSerializer.load(new StringReader(json));

        assertThat(recipe.getName()).isEqualTo("xray");
        assertThat(recipe.getSteps()).hasSize(4);
        assertThat(recipe.getSteps().get(0).getParams()).containsEntry("clip_limit", "3.0").containsEntry("grid_size", "4");
        assertThat(recipe.getSteps().get(1).getParams()).containsOnlyKeys("highlight_only");
        assertThat(recipe.getSteps().get(2).getParams().get("points")).isEqualTo("[[0,0],[255,128]]");
        assertThat(recipe.getSteps().get(3).getParams()).isEmpty();
    }

    @Test
    void rejectsStepWithoutOperation() {
        assertThatThrownBy(() -> RecipeSerializer.load(new StringReader("{\"steps\": [{\"params\": {}}]}")))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("Step 0");
    }

    @Test
    void rejectsNonObjectDocument() {
        assertThatThrownBy(() -> RecipeSerializer.load(new StringReader("[1, 2]")))
                .isInstanceOf(JsonParseException.class);
    }

    @Test
    void saveThenLoadKeepsSteps() throws IOException {
        Recipe recipe = new Recipe("night", Arrays.asList(
                new RecipeStep("gamma_correction", Collections.singletonMap("gamma", "1.8")),
                new RecipeStep("noise_reduction")));
        Path file = tempDir.resolve("night.json");

        RecipeSerializer.save(recipe, file);
        Recipe loaded = RecipeSerializer.load(file);

        assertThat(loaded.getName()).isEqualTo("night");
        assertThat(loaded.getSteps()).extracting(RecipeStep::getOperation)
                .containsExactly("gamma_correction", "noise_reduction");
        assertThat(loaded.getSteps().get(0).getParams()).containsEntry("gamma", "1.8");
    }
}
