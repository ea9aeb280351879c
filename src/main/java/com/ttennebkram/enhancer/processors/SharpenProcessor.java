package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Sharpen with a fixed 3x3 high-pass kernel: center {@code 9 + strength},
 * the eight neighbours {@code -1}. The kernel is not normalized.
 */
@ProcessorInfo(
    operation = "sharpen",
    category = "Spatial",
    description = "3x3 sharpening kernel\nImgproc.filter2D(src, dst, -1, [[-1,-1,-1],[-1,9+s,-1],[-1,-1,-1]])"
)
public class SharpenProcessor extends ProcessorBase<SharpenProcessor.Params> {

    public static final class Params {
        public final double strength;

        public Params(double strength) {
            this.strength = strength;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        return new Params(reader.getDouble("strength", 1.0));
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        Mat kernel = new Mat(3, 3, CvType.CV_32F, new Scalar(-1));
        kernel.put(1, 1, 9.0 + params.strength);
        try {
            Mat output = new Mat();
            // Same depth output saturates to [0, 255]
            Imgproc.filter2D(input.mat(), output, -1, kernel);
            return result(RasterImage.adopt(output));
        } finally {
            kernel.release();
        }
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("strength", params.strength);
    }
}
