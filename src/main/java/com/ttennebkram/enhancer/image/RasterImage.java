package com.ttennebkram.enhancer.image;

import com.ttennebkram.enhancer.util.OpenCVLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.Objects;

/**
 * A decoded 8-bit raster image, either {@link GrayImage} or {@link ColorImage}.
 *
 * The backing {@link Mat} is owned by the image. Transforms read it through
 * {@link #mat()} and always allocate a new Mat for their result, so an image
 * handed to the engine is never modified.
 */
public abstract class RasterImage {

    static {
        OpenCVLoader.ensureLoaded();
    }

    protected final Mat mat;

    RasterImage(Mat mat) {
        this.mat = mat;
    }

    /**
     * Copy an OpenCV Mat into a new image.
     * Accepts CV_8UC1, CV_8UC3 and CV_8UC4 (alpha is dropped).
     *
     * @throws IllegalArgumentException for empty Mats or other pixel types
     */
    public static RasterImage wrap(Mat source) {
        Objects.requireNonNull(source, "source");
        if (source.empty()) {
            throw new IllegalArgumentException("Empty image");
        }
        int type = source.type();
        if (type == CvType.CV_8UC1) {
            return new GrayImage(source.clone());
        }
        if (type == CvType.CV_8UC3) {
            return new ColorImage(source.clone());
        }
        if (type == CvType.CV_8UC4) {
            Mat bgr = new Mat();
            Imgproc.cvtColor(source, bgr, Imgproc.COLOR_BGRA2BGR);
            return new ColorImage(bgr);
        }
        throw new IllegalArgumentException("Unsupported pixel type: " + CvType.typeToString(type));
    }

    /**
     * Take ownership of a Mat without copying it.
     * The caller must not use or release the Mat afterwards.
     */
    public static RasterImage adopt(Mat owned) {
        Objects.requireNonNull(owned, "owned");
        int type = owned.type();
        if (type == CvType.CV_8UC1) {
            return new GrayImage(owned);
        }
        if (type == CvType.CV_8UC3) {
            return new ColorImage(owned);
        }
        throw new IllegalArgumentException("Unsupported pixel type: " + CvType.typeToString(type));
    }

    public static GrayImage gray(int height, int width, byte[] pixels) {
        checkBuffer(height, width, 1, pixels);
        Mat m = new Mat(height, width, CvType.CV_8UC1);
        m.put(0, 0, pixels);
        return new GrayImage(m);
    }

    /**
     * @param pixels interleaved blue, green, red bytes, row-major
     */
    public static ColorImage color(int height, int width, byte[] pixels) {
        checkBuffer(height, width, 3, pixels);
        Mat m = new Mat(height, width, CvType.CV_8UC3);
        m.put(0, 0, pixels);
        return new ColorImage(m);
    }

    public static GrayImage filledGray(int height, int width, int value) {
        checkSize(height, width);
        return new GrayImage(new Mat(height, width, CvType.CV_8UC1, new Scalar(value)));
    }

    public static ColorImage filledColor(int height, int width, int blue, int green, int red) {
        checkSize(height, width);
        return new ColorImage(new Mat(height, width, CvType.CV_8UC3, new Scalar(blue, green, red)));
    }

    private static void checkSize(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + height + "x" + width);
        }
    }

    private static void checkBuffer(int height, int width, int channels, byte[] pixels) {
        checkSize(height, width);
        Objects.requireNonNull(pixels, "pixels");
        long expected = (long) height * width * channels;
        if (pixels.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " bytes for " + height + "x" + width + "x" + channels
                            + " but got " + pixels.length);
        }
    }

    public abstract ImageVariant variant();

    /**
     * Grayscale view of this image. Returns this image if it already is one.
     */
    public abstract GrayImage toGray();

    /**
     * Three-channel view of this image. Returns this image if it already is one.
     */
    public abstract ColorImage toColor();

    /**
     * Convert to the given variant, returning this image if nothing changes.
     */
    public RasterImage as(ImageVariant target) {
        return target == ImageVariant.GRAY ? toGray() : toColor();
    }

    public int height() {
        return mat.rows();
    }

    public int width() {
        return mat.cols();
    }

    public int channels() {
        return variant().channels();
    }

    public boolean isColor() {
        return variant() == ImageVariant.COLOR;
    }

    /**
     * The backing Mat. Treat as read-only; do not release.
     */
    public Mat mat() {
        return mat;
    }

    /**
     * Copy of the pixel data, row-major, channels interleaved.
     */
    public byte[] toBytes() {
        byte[] data = new byte[height() * width() * channels()];
        mat.get(0, 0, data);
        return data;
    }

    /**
     * Unsigned value of one channel of one pixel.
     */
    public int get(int row, int col, int channel) {
        if (channel < 0 || channel >= channels()) {
            throw new IndexOutOfBoundsException("channel " + channel);
        }
        byte[] px = new byte[channels()];
        mat.get(row, col, px);
        return px[channel] & 0xFF;
    }

    public boolean sameShape(RasterImage other) {
        return other != null
                && height() == other.height()
                && width() == other.width()
                && channels() == other.channels();
    }

    /**
     * Free the native buffer early. The image must not be used afterwards.
     */
    public void release() {
        mat.release();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + height() + "x" + width() + "x" + channels() + "]";
    }
}
