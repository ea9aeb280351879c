package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;

/**
 * DICOM-style window/level.
 * Intensities are clipped to {@code [level - width/2, level + width/2]}, then the
 * clipped image's own min..max is stretched linearly over 0..255. A clipped image
 * with a single value comes out black.
 */
@ProcessorInfo(
    operation = "dicom_window",
    category = "Tonal",
    description = "Window/level on grayscale\nclip(v, level - width/2, level + width/2), then Core.normalize(NORM_MINMAX, 0, 255)"
)
public class DicomWindowProcessor extends ProcessorBase<DicomWindowProcessor.Params> {

    public static final class Params {
        public final double windowWidth;
        public final double windowLevel;

        public Params(double windowWidth, double windowLevel) {
            this.windowWidth = windowWidth;
            this.windowLevel = windowLevel;
        }

        public double lower() {
            return windowLevel - windowWidth / 2.0;
        }

        public double upper() {
            return windowLevel + windowWidth / 2.0;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double width = reader.getDouble("window_width", 400);
        double level = reader.getDouble("window_level", 50);
        reader.requirePositive("window_width", width);
        return new Params(width, level);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        GrayImage gray = input.toGray();
        try {
            Core.MinMaxLocResult range = Core.minMaxLoc(gray.mat());
            int[] table = buildTable(params, range.minVal, range.maxVal);
            return result(restoreChannels(applyLut(gray.mat(), table), input));
        } finally {
            releaseIfDerived(gray, input);
        }
    }

    /**
     * @param minVal darkest intensity present in the image
     * @param maxVal brightest intensity present in the image
     */
    static int[] buildTable(Params params, double minVal, double maxVal) {
        // Clipping is monotonic, so the clipped extremes are the clipped input extremes
        double low = clip(params, minVal);
        double high = clip(params, maxVal);
        int[] table = new int[LUT_SIZE];
        if (high <= low) {
            return table;
        }
        double scale = 255.0 / (high - low);
        for (int i = 0; i < LUT_SIZE; i++) {
            table[i] = clampToByte((clip(params, i) - low) * scale);
        }
        return table;
    }

    private static double clip(Params params, double value) {
        return Math.max(params.lower(), Math.min(params.upper(), value));
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("window_width", params.windowWidth);
        json.addProperty("window_level", params.windowLevel);
    }
}
