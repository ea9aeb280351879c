package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.ImageVariant;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Sepia toning blended with the original by {@code intensity}.
 */
@ProcessorInfo(
    operation = "sepia_filter",
    category = "Color",
    description = "Sepia tone\nCore.transform(src, sepia, M); Core.addWeighted(src, 1 - i, sepia, i, 0)",
    accepts = {ImageVariant.COLOR}
)
public class SepiaFilterProcessor extends ProcessorBase<SepiaFilterProcessor.Params> {

    // Standard sepia matrix, rows and columns reordered for blue, green, red storage
    private static final double[][] SEPIA_BGR = {
        {0.131, 0.534, 0.272},  // out blue
        {0.168, 0.686, 0.349},  // out green
        {0.189, 0.769, 0.393},  // out red
    };

    public static final class Params {
        public final double intensity;

        public Params(double intensity) {
            this.intensity = intensity;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double intensity = reader.getDouble("intensity", 0.5);
        reader.requireRange("intensity", intensity, 0, 1);
        return new Params(intensity);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        Mat normalized = new Mat();
        Mat matrix = new Mat(3, 3, CvType.CV_32F);
        Mat sepia = new Mat();
        Mat blended = new Mat();
        try {
            input.mat().convertTo(normalized, CvType.CV_32FC3, 1.0 / 255.0);
            for (int row = 0; row < 3; row++) {
                matrix.put(row, 0, SEPIA_BGR[row]);
            }
            Core.transform(normalized, sepia, matrix);
            Core.min(sepia, new Scalar(1.0, 1.0, 1.0), sepia);

            Core.addWeighted(normalized, 1.0 - params.intensity, sepia, params.intensity, 0, blended);

            Mat output = new Mat();
            blended.convertTo(output, CvType.CV_8UC3, 255.0);
            return result(RasterImage.adopt(output));
        } finally {
            normalized.release();
            matrix.release();
            sepia.release();
            blended.release();
        }
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("intensity", params.intensity);
    }
}
