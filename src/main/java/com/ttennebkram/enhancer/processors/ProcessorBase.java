package com.ttennebkram.enhancer.processors;

import com.ttennebkram.enhancer.engine.EngineConfig;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.image.ImageVariant;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Abstract base class for catalog processors.
 * Reads metadata from {@link ProcessorInfo} and provides the lookup table and
 * channel helpers most transforms share.
 */
public abstract class ProcessorBase<P> implements EnhancementProcessor<P> {

    /** Number of entries in an 8-bit lookup table */
    protected static final int LUT_SIZE = 256;

    protected EngineConfig config = EngineConfig.defaults();

    private final ProcessorInfo info;

    protected ProcessorBase() {
        info = getClass().getAnnotation(ProcessorInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @ProcessorInfo");
        }
    }

    @Override
    public void configure(EngineConfig config) {
        this.config = config;
    }

    @Override
    public String getOperation() {
        return info.operation();
    }

    @Override
    public String getCategory() {
        return info.category();
    }

    @Override
    public String getDescription() {
        return info.description();
    }

    @Override
    public Set<ImageVariant> getAcceptedVariants() {
        return Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(info.accepts())));
    }

    protected EnhancementResult result(RasterImage image) {
        return EnhancementResult.ofImage(getOperation(), image);
    }

    /**
     * Round and clamp to the 8-bit range.
     */
    protected static int clampToByte(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) return 0;
        if (rounded > 255) return 255;
        return (int) rounded;
    }

    /**
     * Kernel sizes must be odd: even values are bumped up by one.
     */
    protected static int oddKernelSize(int size) {
        return size % 2 == 0 ? size + 1 : size;
    }

    /**
     * Build a 1x256 CV_8U table. Every entry is clamped to [0, 255].
     */
    protected static Mat buildLut(int[] table) {
        if (table.length != LUT_SIZE) {
            throw new IllegalArgumentException("Lookup table needs " + LUT_SIZE + " entries, got " + table.length);
        }
        byte[] bytes = new byte[LUT_SIZE];
        for (int i = 0; i < LUT_SIZE; i++) {
            bytes[i] = (byte) clampToByte(table[i]);
        }
        Mat lut = new Mat(1, LUT_SIZE, CvType.CV_8UC1);
        lut.put(0, 0, bytes);
        return lut;
    }

    /**
     * Map every channel of every pixel through the same table.
     */
    protected static Mat applyLut(Mat input, int[] table) {
        Mat lut = buildLut(table);
        try {
            Mat output = new Mat();
            Core.LUT(input, lut, output);
            return output;
        } finally {
            lut.release();
        }
    }

    /**
     * Wrap a single-channel result, replicating it to three channels when the
     * original input was color. Takes ownership of {@code gray}.
     */
    protected static RasterImage restoreChannels(Mat gray, RasterImage original) {
        if (!original.isColor()) {
            return RasterImage.adopt(gray);
        }
        Mat bgr = new Mat();
        try {
            Imgproc.cvtColor(gray, bgr, Imgproc.COLOR_GRAY2BGR);
        } finally {
            gray.release();
        }
        return RasterImage.adopt(bgr);
    }

    /**
     * Free a converted copy of the input; does nothing if no conversion happened.
     */
    protected static void releaseIfDerived(RasterImage derived, RasterImage original) {
        if (derived != original) {
            derived.release();
        }
    }
}
