package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;

/**
 * Log transform, {@code out = c * ln(1 + in)}, with {@code c} chosen per channel
 * so the channel maximum maps to 255. All-zero channels pass through.
 */
@ProcessorInfo(
    operation = "log_transformation",
    category = "Tonal",
    description = "Logarithmic intensity mapping\nc = 255 / ln(1 + max); Core.LUT per channel"
)
public class LogTransformationProcessor extends ProcessorBase<NoParameters> {

    @Override
    public NoParameters parseParameters(ParameterReader reader) {
        return NoParameters.INSTANCE;
    }

    @Override
    public EnhancementResult process(RasterImage input, NoParameters params) {
        List<Mat> channels = new ArrayList<>();
        List<Mat> mapped = new ArrayList<>();
        try {
            Core.split(input.mat(), channels);
            for (Mat channel : channels) {
                double maxVal = Core.minMaxLoc(channel).maxVal;
                if (maxVal > 0) {
                    mapped.add(applyLut(channel, buildTable(maxVal)));
                } else {
                    mapped.add(channel.clone());
                }
            }

            Mat output = new Mat();
            Core.merge(mapped, output);
            return result(RasterImage.adopt(output));
        } finally {
            for (Mat m : channels) m.release();
            for (Mat m : mapped) m.release();
        }
    }

    static int[] buildTable(double maxVal) {
        double c = 255.0 / Math.log1p(maxVal);
        int[] table = new int[LUT_SIZE];
        for (int i = 0; i < LUT_SIZE; i++) {
            table[i] = clampToByte(c * Math.log1p(i));
        }
        return table;
    }

    @Override
    public void serializeParameters(NoParameters params, JsonObject json) {
        // No parameters
    }
}
