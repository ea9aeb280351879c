package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Mat;
import org.opencv.photo.Photo;

/**
 * Non-local means denoising.
 * The strength is used for both luminance and color components.
 */
@ProcessorInfo(
    operation = "noise_reduction",
    category = "Spatial",
    description = "Non-local means denoising\nPhoto.fastNlMeansDenoisingColored(src, dst, h, h, 7, 21)"
)
public class NoiseReductionProcessor extends ProcessorBase<NoiseReductionProcessor.Params> {

    static final int TEMPLATE_WINDOW = 7;
    static final int SEARCH_WINDOW = 21;

    public static final class Params {
        public final double strength;

        public Params(double strength) {
            this.strength = strength;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double strength = reader.getDouble("strength", 7);
        reader.requireAtLeast("strength", strength, 0);
        return new Params(strength);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        float h = (float) params.strength;
        Mat output = new Mat();
        if (input.isColor()) {
            Photo.fastNlMeansDenoisingColored(input.mat(), output, h, h, TEMPLATE_WINDOW, SEARCH_WINDOW);
        } else {
            Photo.fastNlMeansDenoising(input.mat(), output, h, TEMPLATE_WINDOW, SEARCH_WINDOW);
        }
        return result(RasterImage.adopt(output));
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("strength", params.strength);
    }
}
