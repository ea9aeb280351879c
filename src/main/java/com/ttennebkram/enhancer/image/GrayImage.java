package com.ttennebkram.enhancer.image;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Single-channel 8-bit image.
 */
public final class GrayImage extends RasterImage {

    GrayImage(Mat mat) {
        super(mat);
    }

    @Override
    public ImageVariant variant() {
        return ImageVariant.GRAY;
    }

    @Override
    public GrayImage toGray() {
        return this;
    }

    /**
     * Replicates the intensity into all three channels.
     */
    @Override
    public ColorImage toColor() {
        Mat bgr = new Mat();
        Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_GRAY2BGR);
        return new ColorImage(bgr);
    }
}
