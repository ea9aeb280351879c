package com.ttennebkram.enhancer.image;

import com.ttennebkram.enhancer.engine.DecodeFailureException;
import com.ttennebkram.enhancer.util.OpenCVLoader;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts between encoded image bytes and {@link RasterImage}.
 * This is the boundary where malformed uploads are rejected, before the engine sees them.
 */
public final class ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);

    public static final int DEFAULT_QUALITY = 95;

    private ImageCodec() {
    }

    /**
     * Decode to a three-channel BGR image.
     */
    public static ColorImage decode(byte[] data) throws DecodeFailureException {
        return (ColorImage) decode(data, Imgcodecs.IMREAD_COLOR);
    }

    /**
     * Decode to a single-channel image.
     */
    public static GrayImage decodeGrayscale(byte[] data) throws DecodeFailureException {
        return (GrayImage) decode(data, Imgcodecs.IMREAD_GRAYSCALE);
    }

    private static RasterImage decode(byte[] data, int flags) throws DecodeFailureException {
        OpenCVLoader.ensureLoaded();
        if (data == null || data.length == 0) {
            throw new DecodeFailureException("No image data");
        }
        MatOfByte buffer = new MatOfByte(data);
        Mat decoded = Imgcodecs.imdecode(buffer, flags);
        buffer.release();
        if (decoded == null || decoded.empty()) {
            throw new DecodeFailureException("Invalid image format (" + data.length + " bytes)");
        }
        return RasterImage.adopt(decoded);
    }

    public static ColorImage read(Path path) throws IOException, DecodeFailureException {
        byte[] data = Files.readAllBytes(path);
        try {
            return decode(data);
        } catch (DecodeFailureException e) {
            throw new DecodeFailureException("Cannot decode " + path + ": " + e.getMessage(), e);
        }
    }

    public static byte[] encode(RasterImage image, OutputFormat format) {
        return encode(image, format, DEFAULT_QUALITY);
    }

    /**
     * @param quality 1-100, used by JPEG and WEBP; PNG ignores it
     */
    public static byte[] encode(RasterImage image, OutputFormat format, int quality) {
        OpenCVLoader.ensureLoaded();
        int q = Math.max(1, Math.min(100, quality));
        MatOfInt encodeParams;
        switch (format) {
            case JPEG:
                encodeParams = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, q);
                break;
            case WEBP:
                encodeParams = new MatOfInt(Imgcodecs.IMWRITE_WEBP_QUALITY, q);
                break;
            case PNG:
            default:
                encodeParams = new MatOfInt();
                break;
        }
        MatOfByte out = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(format.extension(), image.mat(), out, encodeParams)) {
                throw new IllegalStateException("OpenCV could not encode " + format);
            }
            return out.toArray();
        } finally {
            out.release();
            encodeParams.release();
        }
    }

    public static void write(Path path, RasterImage image, int quality) throws IOException {
        OutputFormat format = OutputFormat.fromFileName(path.getFileName().toString());
        byte[] bytes = encode(image, format, quality);
        Files.write(path, bytes);
        logger.debug("Wrote {} ({} bytes, {})", path, bytes.length, format);
    }
}
