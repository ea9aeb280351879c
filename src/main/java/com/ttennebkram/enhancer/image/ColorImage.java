package com.ttennebkram.enhancer.image;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Three-channel 8-bit image, channels ordered blue, green, red.
 */
public final class ColorImage extends RasterImage {

    ColorImage(Mat mat) {
        super(mat);
    }

    @Override
    public ImageVariant variant() {
        return ImageVariant.COLOR;
    }

    @Override
    public GrayImage toGray() {
        Mat gray = new Mat();
        Imgproc.cvtColor(mat, gray, Imgproc.COLOR_BGR2GRAY);
        return new GrayImage(gray);
    }

    @Override
    public ColorImage toColor() {
        return this;
    }
}
