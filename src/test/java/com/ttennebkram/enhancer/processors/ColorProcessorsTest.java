package com.ttennebkram.enhancer.processors;

import com.ttennebkram.enhancer.TestImages;
import com.ttennebkram.enhancer.engine.EngineConfig;
import com.ttennebkram.enhancer.engine.EnhancementEngine;
import com.ttennebkram.enhancer.engine.EnhancementException;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.image.ColorImage;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.Palette;
import com.ttennebkram.enhancer.image.RasterImage;
import com.ttennebkram.enhancer.image.Swatch;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ColorProcessorsTest {

    private static EnhancementEngine engine;

    @BeforeAll
    static void setUp() {
        engine = new EnhancementEngine(EngineConfig.defaults());
    }

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Test
    void colorBalanceScalesEachChannel() throws EnhancementException {
        ColorImage gray = RasterImage.filledColor(4, 4, 100, 100, 100);

        RasterImage out = engine.apply("color_balance", gray, params("r_factor", "2", "b_factor", "0.5")).image();

        assertThat(out.get(2, 2, 0)).isEqualTo(50);
        assertThat(out.get(2, 2, 1)).isEqualTo(100);
        assertThat(out.get(2, 2, 2)).isEqualTo(200);
    }

    @Test
    void colorBalanceSaturates() throws EnhancementException {
        ColorImage image = RasterImage.filledColor(2, 2, 200, 200, 200);

        RasterImage out = engine.apply("color_balance", image, params("g_factor", "5")).image();

        assertThat(out.get(0, 0, 1)).isEqualTo(255);
    }

    @Test
    void colorBalanceRejectsNegativeFactor() {
        assertThatThrownBy(() -> engine.apply("color_balance", RasterImage.filledColor(2, 2, 0, 0, 0),
                params("g_factor", "-0.1")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("g_factor");
    }

    @Test
    void colorBalancePromotesGrayInput() throws EnhancementException {
        GrayImage gray = RasterImage.filledGray(3, 3, 100);

        RasterImage out = engine.apply("color_balance", gray, params("r_factor", "2")).image();

        assertThat(out.channels()).isEqualTo(3);
        assertThat(out.get(0, 0, 2)).isEqualTo(200);
        assertThat(out.get(0, 0, 0)).isEqualTo(100);
    }

    @Test
    void sepiaFullIntensityOnWhite() throws EnhancementException {
        ColorImage white = RasterImage.filledColor(4, 4, 255, 255, 255);

        RasterImage out = engine.apply("sepia_filter", white, params("intensity", "1")).image();

        assertThat(out.get(1, 1, 0)).isEqualTo(239);
        assertThat(out.get(1, 1, 1)).isEqualTo(255);
        assertThat(out.get(1, 1, 2)).isEqualTo(255);
    }

    @Test
    void sepiaZeroIntensityIsIdentity() throws EnhancementException {
        ColorImage ramp = TestImages.colorRamp(12, 12);

        RasterImage out = engine.apply("sepia_filter", ramp, params("intensity", "0")).image();

        int[] expected = TestImages.unsigned(ramp.toBytes());
        int[] actual = TestImages.unsigned(out.toBytes());
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual[i]).isCloseTo(expected[i], within(1));
        }
    }

    @Test
    void sepiaWarmsTheImage() throws EnhancementException {
        ColorImage midGray = RasterImage.filledColor(4, 4, 128, 128, 128);

        RasterImage out = engine.apply("sepia_filter", midGray).image();

        assertThat(out.get(0, 0, 2)).isGreaterThan(out.get(0, 0, 0));
    }

    @Test
    void sepiaRejectsIntensityAboveOne() {
        assertThatThrownBy(() -> engine.apply("sepia_filter", RasterImage.filledColor(2, 2, 0, 0, 0),
                params("intensity", "1.5")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("intensity");
    }

    @Test
    void paletteOfSolidImage() throws EnhancementException {
        ColorImage solid = RasterImage.filledColor(150, 150, 30, 120, 200);

        Palette palette = engine.apply("extract_palette", solid, params("num_colors", "1")).palette();

        assertThat(palette.hexColors()).containsExactly("c87820");
        assertThat(palette.get(0).coverage()).isEqualTo(1.0);
    }

    @Test
    void paletteIsOrderedByCoverage() throws EnhancementException {
        // 100 rows red, 50 rows blue
        ColorImage bands = TestImages.colorBands(150, 150, 100, new int[]{0, 0, 255}, new int[]{255, 0, 0});

        Palette palette = engine.apply("extract_palette", bands, params("num_colors", "2")).palette();

        assertThat(palette.hexColors()).containsExactly("ff0000", "0000ff");
        Swatch dominant = palette.get(0);
        assertThat(dominant.pixelCount()).isEqualTo(100 * 150);
        assertThat(dominant.coverage()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void paletteNeverExceedsRequestedColors() throws EnhancementException {
        ColorImage ramp = TestImages.colorRamp(40, 60);

        Palette palette = engine.apply("extract_palette", ramp).palette();

        assertThat(palette.size()).isBetween(1, 5);
        double total = 0;
        for (Swatch s : palette.swatches()) {
            total += s.coverage();
        }
        assertThat(total).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void paletteIsRepeatableWithSeed() throws EnhancementException {
        ColorImage ramp = TestImages.colorRamp(50, 50);

        Palette first = engine.apply("extract_palette", ramp, params("num_colors", "4")).palette();
        Palette second = engine.apply("extract_palette", ramp, params("num_colors", "4")).palette();

        assertThat(second.hexColors()).isEqualTo(first.hexColors());
    }

    @Test
    void paletteColorLimitComesFromConfig() {
        EnhancementEngine small = new EnhancementEngine(
                EngineConfig.fromReader(new StringReader("{\"maxPaletteColors\": 3}")));
        ColorImage image = RasterImage.filledColor(10, 10, 1, 2, 3);

        assertThatThrownBy(() -> small.apply("extract_palette", image, params("num_colors", "4")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("num_colors");
    }

    @Test
    void paletteRejectsZeroColors() {
        assertThatThrownBy(() -> engine.apply("extract_palette", RasterImage.filledColor(4, 4, 0, 0, 0),
                params("num_colors", "0")))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void paletteAcceptsGrayInput() throws EnhancementException {
        GrayImage gray = RasterImage.filledGray(150, 150, 90);

        Palette palette = engine.apply("extract_palette", gray, Collections.singletonMap("num_colors", "1")).palette();

        assertThat(palette.hexColors()).containsExactly("5a5a5a");
    }
}
