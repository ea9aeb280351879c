package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * CLAHE (Contrast Limited Adaptive Histogram Equalization) processor.
 * Enhances local contrast while limiting noise amplification.
 * Color images are processed on the L channel of L*a*b* only.
 */
@ProcessorInfo(
    operation = "clahe_enhance",
    category = "Tonal",
    description = "CLAHE (Contrast Limited Adaptive Histogram Equalization)\nImgproc.createCLAHE(clipLimit, gridSize x gridSize) on L*"
)
public class ClaheProcessor extends ProcessorBase<ClaheProcessor.Params> {

    static final int MAX_GRID_SIZE = 64;

    public static final class Params {
        public final double clipLimit;
        public final int gridSize;

        public Params(double clipLimit, int gridSize) {
            this.clipLimit = clipLimit;
            this.gridSize = gridSize;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double clipLimit = reader.getDouble("clip_limit", 2.0);
        int gridSize = reader.getInt("grid_size", 8);
        reader.requirePositive("clip_limit", clipLimit);
        reader.requireRange("grid_size", gridSize, 1, MAX_GRID_SIZE);
        return new Params(clipLimit, gridSize);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        CLAHE clahe = Imgproc.createCLAHE(params.clipLimit, new Size(params.gridSize, params.gridSize));

        if (!input.isColor()) {
            Mat output = new Mat();
            clahe.apply(input.mat(), output);
            return result(RasterImage.adopt(output));
        }

        Mat lab = new Mat();
        List<Mat> labChannels = new ArrayList<>();
        try {
            Imgproc.cvtColor(input.mat(), lab, Imgproc.COLOR_BGR2Lab);
            Core.split(lab, labChannels);

            // Apply CLAHE to L channel
            Mat lChannel = new Mat();
            clahe.apply(labChannels.get(0), lChannel);
            labChannels.get(0).release();
            labChannels.set(0, lChannel);
            Core.merge(labChannels, lab);

            Mat output = new Mat();
            Imgproc.cvtColor(lab, output, Imgproc.COLOR_Lab2BGR);
            return result(RasterImage.adopt(output));
        } finally {
            lab.release();
            for (Mat m : labChannels) m.release();
        }
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("clip_limit", params.clipLimit);
        json.addProperty("grid_size", params.gridSize);
    }
}
