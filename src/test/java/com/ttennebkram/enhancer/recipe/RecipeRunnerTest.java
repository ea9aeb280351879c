package com.ttennebkram.enhancer.recipe;

import com.ttennebkram.enhancer.TestImages;
import com.ttennebkram.enhancer.engine.EngineConfig;
import com.ttennebkram.enhancer.engine.EnhancementEngine;
import com.ttennebkram.enhancer.engine.EnhancementException;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ProcessingFailureException;
import com.ttennebkram.enhancer.engine.UnknownOperationException;
import com.ttennebkram.enhancer.image.ColorImage;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.RasterImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipeRunnerTest {

    private static EnhancementEngine engine;
    private static RecipeRunner runner;

    @BeforeAll
    static void setUp() {
        engine = new EnhancementEngine(EngineConfig.defaults());
        runner = new RecipeRunner(engine);
    }

    private static RecipeStep step(String operation, String key, String value) {
        return new RecipeStep(operation, Collections.singletonMap(key, value));
    }

    @Test
    void stepsAreChained() throws EnhancementException {
        GrayImage input = TestImages.allIntensities();
        Recipe recipe = new Recipe("invert-then-threshold", Arrays.asList(
                step("piecewise_linear_transform", "points", "0,255;255,0"),
                step("bit_plane_slicing", "bit_plane", "7")));

        int[] out = TestImages.unsigned(runner.run(recipe, input).image().toBytes());

        // 255 - 10 has the top bit set, 255 - 200 does not
        assertThat(out[10]).isEqualTo(255);
        assertThat(out[200]).isZero();
    }

    @Test
    void inputIsNotModified() throws EnhancementException {
        ColorImage input = TestImages.colorRamp(12, 12);
        byte[] before = input.toBytes();
        Recipe recipe = new Recipe("r", Arrays.asList(
                new RecipeStep("sharpen"), new RecipeStep("sepia_filter"), new RecipeStep("gaussian_blur")));

        runner.run(recipe, input);

        assertThat(input.toBytes()).isEqualTo(before);
    }

    @Test
    void emptyRecipeReturnsInput() throws EnhancementException {
        GrayImage input = RasterImage.filledGray(3, 3, 9);

        EnhancementResult result = runner.run(new Recipe("empty", Collections.emptyList()), input);

        assertThat(result.image()).isSameAs(input);
    }

    @Test
    void paletteMayEndARecipe() throws EnhancementException {
        ColorImage input = RasterImage.filledColor(150, 150, 30, 120, 200);
        Recipe recipe = new Recipe("p", Arrays.asList(
                step("gamma_correction", "gamma", "1"),
                step("extract_palette", "num_colors", "1")));

        EnhancementResult result = runner.run(recipe, input);

        assertThat(result.palette().hexColors()).containsExactly("c87820");
    }

    @Test
    void stepNamesAreTrimmedLikeSingleCalls() throws EnhancementException {
        GrayImage input = RasterImage.filledGray(4, 4, 100);
        Recipe recipe = new Recipe("padded", Collections.singletonList(new RecipeStep(" sharpen ")));

        EnhancementResult result = runner.run(recipe, input);

        assertThat(TestImages.unsigned(result.image().toBytes())).containsOnly(200);
    }

    @Test
    void paletteBeforeTheLastStepIsRejected() {
        Recipe recipe = new Recipe("bad", Arrays.asList(
                new RecipeStep("extract_palette"), new RecipeStep("sharpen")));

        assertThatThrownBy(() -> runner.validate(recipe))
                .isInstanceOf(ProcessingFailureException.class)
                .hasMessageContaining("palette");
    }

    @Test
    void unknownOperationFailsBeforeAnythingRuns() {
        Recipe recipe = new Recipe("bad", Arrays.asList(
                new RecipeStep("sharpen"), new RecipeStep("posterize")));

        assertThatThrownBy(() -> runner.run(recipe, RasterImage.filledGray(2, 2, 0)))
                .isInstanceOf(UnknownOperationException.class);
    }

    @Test
    void invalidParameterStopsTheRecipe() {
        Recipe recipe = new Recipe("bad", Arrays.asList(
                new RecipeStep("sharpen"), step("super_resolution", "scale_factor", "99")));

        assertThatThrownBy(() -> runner.run(recipe, RasterImage.filledGray(2, 2, 0)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("scale_factor");
    }
}
