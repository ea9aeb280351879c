package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Edge enhancement tuned for thin vessels in angiograms: a 3x3 blur subtracted
 * from the weighted original.
 */
@ProcessorInfo(
    operation = "enhance_vessels",
    category = "Spatial",
    description = "Fine-structure high pass\nCore.addWeighted(src, 1 + s, GaussianBlur(src, 3x3, 0), -s, 0)"
)
public class EnhanceVesselsProcessor extends ProcessorBase<EnhanceVesselsProcessor.Params> {

    public static final class Params {
        public final double strength;

        public Params(double strength) {
            this.strength = strength;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double strength = reader.getDouble("strength", 1.5);
        reader.requireAtLeast("strength", strength, 0);
        return new Params(strength);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        Mat blurred = new Mat();
        try {
            Imgproc.GaussianBlur(input.mat(), blurred, new Size(3, 3), 0);
            Mat output = new Mat();
            Core.addWeighted(input.mat(), 1.0 + params.strength, blurred, -params.strength, 0, output);
            return result(RasterImage.adopt(output));
        } finally {
            blurred.release();
        }
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("strength", params.strength);
    }
}
