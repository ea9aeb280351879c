package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Integer upscaling with bicubic interpolation.
 * This is plain resampling: no detail is recovered, and no learned model is involved.
 */
@ProcessorInfo(
    operation = "super_resolution",
    category = "Spatial",
    description = "Bicubic upsampling\nImgproc.resize(src, dst, (w * scale, h * scale), 0, 0, INTER_CUBIC)"
)
public class SuperResolutionProcessor extends ProcessorBase<SuperResolutionProcessor.Params> {

    public static final class Params {
        public final int scaleFactor;

        public Params(int scaleFactor) {
            this.scaleFactor = scaleFactor;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        int scale = reader.getInt("scale_factor", 2);
        reader.requireRange("scale_factor", scale, 1, config.getMaxScaleFactor());
        return new Params(scale);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        Size target = new Size((double) input.width() * params.scaleFactor, (double) input.height() * params.scaleFactor);
        Mat output = new Mat();
        Imgproc.resize(input.mat(), output, target, 0, 0, Imgproc.INTER_CUBIC);
        return result(RasterImage.adopt(output));
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("scale_factor", params.scaleFactor);
    }
}
