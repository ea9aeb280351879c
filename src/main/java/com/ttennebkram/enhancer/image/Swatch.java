package com.ttennebkram.enhancer.image;

import java.util.Locale;

/**
 * One palette entry: a 24-bit RGB color and the number of sampled pixels it covers.
 */
public final class Swatch {

    private final int red;
    private final int green;
    private final int blue;
    private final int pixelCount;
    private final double coverage;

    public Swatch(int red, int green, int blue, int pixelCount, double coverage) {
        this.red = clamp(red);
        this.green = clamp(green);
        this.blue = clamp(blue);
        this.pixelCount = pixelCount;
        this.coverage = coverage;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }

    public int red() {
        return red;
    }

    public int green() {
        return green;
    }

    public int blue() {
        return blue;
    }

    /** Packed 0xRRGGBB value. */
    public int rgb() {
        return (red << 16) | (green << 8) | blue;
    }

    /** Six lowercase hex digits, red first, no leading '#'. */
    public String hex() {
        return String.format(Locale.ROOT, "%06x", rgb());
    }

    public int pixelCount() {
        return pixelCount;
    }

    /** Fraction of sampled pixels in this cluster, 0..1. */
    public double coverage() {
        return coverage;
    }

    @Override
    public String toString() {
        return hex() + " (" + pixelCount + ")";
    }
}
