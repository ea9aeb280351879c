package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Global histogram equalization.
 * Color images are equalized on the Y channel of YUV so hues are preserved.
 */
@ProcessorInfo(
    operation = "histogram_equalization",
    category = "Tonal",
    description = "Histogram equalization of luma\nImgproc.cvtColor(src, yuv, COLOR_BGR2YUV); Imgproc.equalizeHist(y, y)"
)
public class HistogramEqualizationProcessor extends ProcessorBase<NoParameters> {

    @Override
    public NoParameters parseParameters(ParameterReader reader) {
        return NoParameters.INSTANCE;
    }

    @Override
    public EnhancementResult process(RasterImage input, NoParameters params) {
        if (!input.isColor()) {
            Mat output = new Mat();
            Imgproc.equalizeHist(input.mat(), output);
            return result(RasterImage.adopt(output));
        }

        Mat yuv = new Mat();
        List<Mat> channels = new ArrayList<>();
        try {
            Imgproc.cvtColor(input.mat(), yuv, Imgproc.COLOR_BGR2YUV);
            Core.split(yuv, channels);

            // Equalize luma only
            Mat equalized = new Mat();
            Imgproc.equalizeHist(channels.get(0), equalized);
            channels.get(0).release();
            channels.set(0, equalized);
            Core.merge(channels, yuv);

            Mat output = new Mat();
            Imgproc.cvtColor(yuv, output, Imgproc.COLOR_YUV2BGR);
            return result(RasterImage.adopt(output));
        } finally {
            yuv.release();
            for (Mat m : channels) m.release();
        }
    }

    @Override
    public void serializeParameters(NoParameters params, JsonObject json) {
        // No parameters
    }
}
