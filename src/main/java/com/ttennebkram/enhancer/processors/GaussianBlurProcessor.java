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
 * Gaussian Blur processor.
 * Square kernel of side {@code radius}, sigma derived from the kernel size.
 */
@ProcessorInfo(
    operation = "gaussian_blur",
    category = "Spatial",
    description = "Gaussian blur\nImgproc.GaussianBlur(src, dst, (radius, radius), 0)"
)
public class GaussianBlurProcessor extends ProcessorBase<GaussianBlurProcessor.Params> {

    public static final class Params {
        /** Always odd */
        public final int kernelSize;

        public Params(int kernelSize) {
            this.kernelSize = kernelSize;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        int radius = reader.getInt("radius", 3);
        reader.requireRange("radius", radius, 0, config.getMaxKernelSize());
        // Kernel sizes must be odd
        return new Params(oddKernelSize(radius));
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        Mat output = new Mat();
        Imgproc.GaussianBlur(input.mat(), output, new Size(params.kernelSize, params.kernelSize), 0);
        return result(RasterImage.adopt(output));
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("radius", params.kernelSize);
    }
}
