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
 * Unsharp mask: {@code (amount + 1) * original - amount * blurred}.
 * With a positive threshold, pixels whose original and blurred values differ by
 * less than the threshold keep their original value, so flat regions and
 * low-level noise are not amplified.
 */
@ProcessorInfo(
    operation = "unsharp_mask",
    category = "Spatial",
    description = "Unsharp mask\nCore.addWeighted(src, amount + 1, GaussianBlur(src), -amount, 0)"
)
public class UnsharpMaskProcessor extends ProcessorBase<UnsharpMaskProcessor.Params> {

    public static final class Params {
        /** Always odd */
        public final int kernelSize;
        public final double amount;
        public final double sigma;
        public final double threshold;

        public Params(int kernelSize, double amount, double sigma, double threshold) {
            this.kernelSize = kernelSize;
            this.amount = amount;
            this.sigma = sigma;
            this.threshold = threshold;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        int radius = reader.getInt("radius", 5);
        double amount = reader.getDouble("amount", 1.0);
        double sigma = reader.getDouble("sigma", 1.0);
        double threshold = reader.getDouble("threshold", 0);
        reader.requireRange("radius", radius, 0, config.getMaxKernelSize());
        reader.requireAtLeast("amount", amount, 0);
        reader.requireAtLeast("sigma", sigma, 0);
        reader.requireAtLeast("threshold", threshold, 0);
        return new Params(oddKernelSize(radius), amount, sigma, threshold);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        Mat original = input.mat();
        Mat blurred = new Mat();
        Mat sharpened = new Mat();
        try {
            Imgproc.GaussianBlur(original, blurred, new Size(params.kernelSize, params.kernelSize), params.sigma);
            // 8-bit destination saturates to [0, 255]
            Core.addWeighted(original, params.amount + 1.0, blurred, -params.amount, 0, sharpened);

            if (params.threshold > 0) {
                revertLowContrast(original, blurred, sharpened, params.threshold);
            }
            Mat output = sharpened;
            sharpened = null;
            return result(RasterImage.adopt(output));
        } finally {
            blurred.release();
            if (sharpened != null) sharpened.release();
        }
    }

    private static void revertLowContrast(Mat original, Mat blurred, Mat sharpened, double threshold) {
        int size = (int) (original.total() * original.channels());
        byte[] orig = new byte[size];
        byte[] blur = new byte[size];
        byte[] sharp = new byte[size];
        original.get(0, 0, orig);
        blurred.get(0, 0, blur);
        sharpened.get(0, 0, sharp);

        for (int i = 0; i < size; i++) {
            int diff = Math.abs((orig[i] & 0xFF) - (blur[i] & 0xFF));
            if (diff < threshold) {
                sharp[i] = orig[i];
            }
        }
        sharpened.put(0, 0, sharp);
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("radius", params.kernelSize);
        json.addProperty("amount", params.amount);
        json.addProperty("sigma", params.sigma);
        json.addProperty("threshold", params.threshold);
    }
}
