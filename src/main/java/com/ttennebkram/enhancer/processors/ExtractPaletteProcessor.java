package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.ImageVariant;
import com.ttennebkram.enhancer.image.Palette;
import com.ttennebkram.enhancer.image.RasterImage;
import com.ttennebkram.enhancer.image.Swatch;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.core.TermCriteria;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dominant colors by k-means clustering of a downscaled copy of the image.
 *
 * The OpenCV RNG is reseeded from configuration before clustering, so the same
 * image always yields the same palette unless seeding is switched off.
 * Empty clusters are dropped.
 */
@ProcessorInfo(
    operation = "extract_palette",
    category = "Color",
    description = "Dominant colors\nImgproc.resize(150x150); Core.kmeans(pixels, k, labels, criteria, attempts, KMEANS_RANDOM_CENTERS, centers)",
    accepts = {ImageVariant.COLOR},
    producesPalette = true
)
public class ExtractPaletteProcessor extends ProcessorBase<ExtractPaletteProcessor.Params> {

    private static final Logger logger = LoggerFactory.getLogger(ExtractPaletteProcessor.class);

    public static final class Params {
        public final int numColors;

        public Params(int numColors) {
            this.numColors = numColors;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        int numColors = reader.getInt("num_colors", 5);
        long samples = (long) config.getPaletteSampleSize() * config.getPaletteSampleSize();
        reader.requireRange("num_colors", numColors, 1, Math.min(config.getMaxPaletteColors(), samples));
        return new Params(numColors);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        int side = config.getPaletteSampleSize();
        Mat small = new Mat();
        Mat samples = new Mat();
        Mat labels = new Mat();
        Mat centers = new Mat();
        try {
            Imgproc.resize(input.mat(), small, new Size(side, side), 0, 0, Imgproc.INTER_AREA);
            // One row per pixel, columns blue, green, red
            small.reshape(1, (int) small.total()).convertTo(samples, CvType.CV_32F);

            if (config.isPaletteSeeded()) {
                Core.setRNGSeed(config.getPaletteSeed());
            }
            TermCriteria criteria = new TermCriteria(TermCriteria.EPS + TermCriteria.MAX_ITER,
                    config.getPaletteMaxIterations(), config.getPaletteEpsilon());
            double compactness = Core.kmeans(samples, params.numColors, labels, criteria,
                    config.getPaletteAttempts(), Core.KMEANS_RANDOM_CENTERS, centers);
            logger.debug("k-means k={} compactness={}", params.numColors, compactness);

            return EnhancementResult.ofPalette(getOperation(), buildPalette(labels, centers, samples.rows()));
        } finally {
            small.release();
            samples.release();
            labels.release();
            centers.release();
        }
    }

    private static Palette buildPalette(Mat labels, Mat centers, int total) {
        int[] assignment = new int[total];
        labels.get(0, 0, assignment);
        int[] counts = new int[centers.rows()];
        for (int label : assignment) {
            counts[label]++;
        }

        List<Swatch> swatches = new ArrayList<>();
        float[] center = new float[3];
        for (int k = 0; k < centers.rows(); k++) {
            if (counts[k] == 0) {
                continue;
            }
            centers.get(k, 0, center);
            swatches.add(new Swatch(
                    Math.round(center[2]), Math.round(center[1]), Math.round(center[0]),
                    counts[k], (double) counts[k] / total));
        }
        swatches.sort(Comparator.comparingInt(Swatch::pixelCount).reversed());
        return new Palette(swatches);
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("num_colors", params.numColors);
    }
}
