package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.ImageVariant;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-channel gain. Channel order in the image is blue, green, red.
 */
@ProcessorInfo(
    operation = "color_balance",
    category = "Color",
    description = "Scale each channel\nCore.split; Mat.convertTo(ch, -1, factor, 0); Core.merge",
    accepts = {ImageVariant.COLOR}
)
public class ColorBalanceProcessor extends ProcessorBase<ColorBalanceProcessor.Params> {

    public static final class Params {
        public final double redFactor;
        public final double greenFactor;
        public final double blueFactor;

        public Params(double redFactor, double greenFactor, double blueFactor) {
            this.redFactor = redFactor;
            this.greenFactor = greenFactor;
            this.blueFactor = blueFactor;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double r = reader.getDouble("r_factor", 1.0);
        double g = reader.getDouble("g_factor", 1.0);
        double b = reader.getDouble("b_factor", 1.0);
        reader.requireAtLeast("r_factor", r, 0);
        reader.requireAtLeast("g_factor", g, 0);
        reader.requireAtLeast("b_factor", b, 0);
        return new Params(r, g, b);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        double[] factors = {params.blueFactor, params.greenFactor, params.redFactor};
        List<Mat> channels = new ArrayList<>();
        try {
            Core.split(input.mat(), channels);
            for (int i = 0; i < channels.size(); i++) {
                // Saturating conversion clamps to [0, 255]
                channels.get(i).convertTo(channels.get(i), -1, factors[i], 0);
            }
            Mat output = new Mat();
            Core.merge(channels, output);
            return result(RasterImage.adopt(output));
        } finally {
            for (Mat m : channels) m.release();
        }
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("r_factor", params.redFactor);
        json.addProperty("g_factor", params.greenFactor);
        json.addProperty("b_factor", params.blueFactor);
    }
}
