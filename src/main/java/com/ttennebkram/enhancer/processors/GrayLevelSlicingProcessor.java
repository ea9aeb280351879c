package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.RasterImage;

/**
 * Gray-level slicing: intensities in {@code [min_val, max_val]} become 255.
 * Others are kept, or set to 0 when {@code highlight_only} is set.
 */
@ProcessorInfo(
    operation = "gray_level_slicing",
    category = "Tonal",
    description = "Highlight an intensity band\nCore.LUT with band -> 255, rest -> unchanged or 0"
)
public class GrayLevelSlicingProcessor extends ProcessorBase<GrayLevelSlicingProcessor.Params> {

    public static final class Params {
        public final double minVal;
        public final double maxVal;
        public final boolean highlightOnly;

        public Params(double minVal, double maxVal, boolean highlightOnly) {
            this.minVal = minVal;
            this.maxVal = maxVal;
            this.highlightOnly = highlightOnly;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double minVal = reader.getDouble("min_val", 100);
        double maxVal = reader.getDouble("max_val", 200);
        boolean highlightOnly = reader.getBoolean("highlight_only", false);
        if (minVal > maxVal) {
            throw reader.invalid("min_val", "must not exceed max_val (" + maxVal + ")");
        }
        return new Params(minVal, maxVal, highlightOnly);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        GrayImage gray = input.toGray();
        try {
            return result(restoreChannels(applyLut(gray.mat(), buildTable(params)), input));
        } finally {
            releaseIfDerived(gray, input);
        }
    }

    static int[] buildTable(Params params) {
        int[] table = new int[LUT_SIZE];
        for (int i = 0; i < LUT_SIZE; i++) {
            if (i >= params.minVal && i <= params.maxVal) {
                table[i] = 255;
            } else {
                table[i] = params.highlightOnly ? 0 : i;
            }
        }
        return table;
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("min_val", params.minVal);
        json.addProperty("max_val", params.maxVal);
        json.addProperty("highlight_only", params.highlightOnly);
    }
}
