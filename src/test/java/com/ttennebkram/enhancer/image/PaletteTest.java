package com.ttennebkram.enhancer.image;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class PaletteTest {

    @Test
    void swatchHexIsRedGreenBlueLowercase() {
        Swatch swatch = new Swatch(200, 120, 30, 10, 1.0);

        assertThat(swatch.hex()).isEqualTo("c87820");
        assertThat(swatch.rgb()).isEqualTo(0xC87820);
    }

    @Test
    void swatchClampsComponents() {
        Swatch swatch = new Swatch(300, -4, 0, 1, 0.5);

        assertThat(swatch.hex()).isEqualTo("ff0000");
    }

    @Test
    void toJson_listsColorsInOrder() {
        Palette palette = new Palette(Arrays.asList(
                new Swatch(255, 0, 0, 30, 0.75),
                new Swatch(0, 0, 255, 10, 0.25)));

        JsonObject json = palette.toJsonObject();

        assertThat(json.getAsJsonArray("colors").get(0).getAsString()).isEqualTo("ff0000");
        assertThat(json.getAsJsonArray("colors").get(1).getAsString()).isEqualTo("0000ff");
        assertThat(json.getAsJsonArray("swatches").get(0).getAsJsonObject().get("pixels").getAsInt()).isEqualTo(30);
        assertThat(palette.toJson()).contains("\"coverage\": 0.25");
    }
}
