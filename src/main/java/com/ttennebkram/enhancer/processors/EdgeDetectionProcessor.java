package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.Locale;

/**
 * Sobel or Canny edge detection.
 *
 * Grayscale input returns the edge map itself (gradient magnitude for Sobel,
 * binary edges for Canny). Color input keeps the original color at edge pixels
 * and blacks out everything else; for Sobel a pixel counts as an edge when its
 * magnitude reaches the configured threshold (50 by default).
 */
@ProcessorInfo(
    operation = "edge_detection",
    category = "Spatial",
    description = "Sobel magnitude or Canny edges\nImgproc.Sobel(gray, gx/gy, CV_32F, 1/0, 0/1, 3); Imgproc.Canny(gray, edges, t1, t2)"
)
public class EdgeDetectionProcessor extends ProcessorBase<EdgeDetectionProcessor.Params> {

    public enum Method {
        SOBEL,
        CANNY
    }

    public static final class Params {
        public final Method method;
        public final double threshold1;
        public final double threshold2;

        public Params(Method method, double threshold1, double threshold2) {
            this.method = method;
            this.threshold1 = threshold1;
            this.threshold2 = threshold2;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        Method method = reader.getEnum("method", Method.class, Method.SOBEL);
        double threshold1 = reader.getDouble("threshold1", 100);
        double threshold2 = reader.getDouble("threshold2", 200);
        reader.requireAtLeast("threshold1", threshold1, 0);
        reader.requireAtLeast("threshold2", threshold2, 0);
        return new Params(method, threshold1, threshold2);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        GrayImage gray = input.toGray();
        Mat edges = null;
        try {
            if (params.method == Method.CANNY) {
                edges = new Mat();
                Imgproc.Canny(gray.mat(), edges, params.threshold1, params.threshold2);
                if (!input.isColor()) {
                    Mat output = edges;
                    edges = null;
                    return result(RasterImage.adopt(output));
                }
                return result(RasterImage.adopt(keepColorWhere(input.mat(), edges)));
            }

            Mat magnitude = sobelMagnitude(gray.mat());
            try {
                if (!input.isColor()) {
                    Mat output = new Mat();
                    // convertTo saturates magnitudes above 255
                    magnitude.convertTo(output, CvType.CV_8U);
                    return result(RasterImage.adopt(output));
                }
                edges = new Mat();
                Core.compare(magnitude, new Scalar(config.getSobelColorThreshold()), edges, Core.CMP_GE);
                return result(RasterImage.adopt(keepColorWhere(input.mat(), edges)));
            } finally {
                magnitude.release();
            }
        } finally {
            if (edges != null) edges.release();
            releaseIfDerived(gray, input);
        }
    }

    private static Mat sobelMagnitude(Mat gray) {
        Mat gradX = new Mat();
        Mat gradY = new Mat();
        try {
            Imgproc.Sobel(gray, gradX, CvType.CV_32F, 1, 0, 3);
            Imgproc.Sobel(gray, gradY, CvType.CV_32F, 0, 1, 3);
            Mat magnitude = new Mat();
            Core.magnitude(gradX, gradY, magnitude);
            return magnitude;
        } finally {
            gradX.release();
            gradY.release();
        }
    }

    private static Mat keepColorWhere(Mat color, Mat mask) {
        Mat output = Mat.zeros(color.size(), color.type());
        color.copyTo(output, mask);
        return output;
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("method", params.method.name().toLowerCase(Locale.ROOT));
        json.addProperty("threshold1", params.threshold1);
        json.addProperty("threshold2", params.threshold2);
    }
}
