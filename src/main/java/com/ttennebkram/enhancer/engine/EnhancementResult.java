package com.ttennebkram.enhancer.engine;

import com.ttennebkram.enhancer.image.Palette;
import com.ttennebkram.enhancer.image.RasterImage;

import java.util.Objects;

/**
 * Output of one operation: a new image, or a palette for {@code extract_palette}.
 */
public final class EnhancementResult {

    private final String operation;
    private final RasterImage image;
    private final Palette palette;

    private EnhancementResult(String operation, RasterImage image, Palette palette) {
        this.operation = operation;
        this.image = image;
        this.palette = palette;
    }

    public static EnhancementResult ofImage(String operation, RasterImage image) {
        return new EnhancementResult(operation, Objects.requireNonNull(image, "image"), null);
    }

    public static EnhancementResult ofPalette(String operation, Palette palette) {
        return new EnhancementResult(operation, null, Objects.requireNonNull(palette, "palette"));
    }

    public String getOperation() {
        return operation;
    }

    public boolean isImage() {
        return image != null;
    }

    public boolean isPalette() {
        return palette != null;
    }

    public RasterImage image() {
        if (image == null) {
            throw new IllegalStateException(operation + " produced a palette, not an image");
        }
        return image;
    }

    public Palette palette() {
        if (palette == null) {
            throw new IllegalStateException(operation + " produced an image, not a palette");
        }
        return palette;
    }

    @Override
    public String toString() {
        return operation + " -> " + (image != null ? image : palette);
    }
}
