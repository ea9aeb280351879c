package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.RasterImage;

/**
 * Bit plane slicing processor.
 * Shows one bit of the grayscale intensity as a black/white mask.
 */
@ProcessorInfo(
    operation = "bit_plane_slicing",
    category = "Tonal",
    description = "Single bit plane of grayscale\n(v & (1 << bit_plane)) != 0 ? 255 : 0"
)
public class BitPlaneSlicingProcessor extends ProcessorBase<BitPlaneSlicingProcessor.Params> {

    public static final class Params {
        /** 0 = least significant, 7 = most significant */
        public final int bitPlane;

        public Params(int bitPlane) {
            this.bitPlane = bitPlane;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        int bitPlane = reader.getInt("bit_plane", 7);
        reader.requireRange("bit_plane", bitPlane, 0, 7);
        return new Params(bitPlane);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        int mask = 1 << params.bitPlane;
        int[] table = new int[LUT_SIZE];
        for (int i = 0; i < LUT_SIZE; i++) {
            table[i] = (i & mask) != 0 ? 255 : 0;
        }

        GrayImage gray = input.toGray();
        try {
            return result(restoreChannels(applyLut(gray.mat(), table), input));
        } finally {
            releaseIfDerived(gray, input);
        }
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("bit_plane", params.bitPlane);
    }
}
