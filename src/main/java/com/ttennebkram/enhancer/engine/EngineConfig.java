package com.ttennebkram.enhancer.engine;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Engine-wide tuning values.
 *
 * Loaded from the classpath resource {@value #RESOURCE}; a file named by the
 * system property {@value #PATH_PROPERTY} takes precedence. Keys missing from
 * the JSON keep the defaults declared here.
 */
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "enhancer.json";
    public static final String PATH_PROPERTY = "enhancer.config";

    private static final Gson GSON = new Gson();

    // gamma <= 0 is replaced with this
    private double gammaFloor = 0.01;
    // Sobel magnitude below which color output pixels are blanked
    private double sobelColorThreshold = 50;
    private int maxKernelSize = 255;
    private int maxScaleFactor = 8;
    private int maxPaletteColors = 64;
    private int paletteSampleSize = 150;
    private int paletteMaxIterations = 100;
    private double paletteEpsilon = 0.2;
    private int paletteAttempts = 10;
    // Negative leaves the OpenCV RNG unseeded
    private int paletteSeed = 42;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Resolve the configuration the way the launcher and engine do.
     */
    public static EngineConfig load() {
        String override = System.getProperty(PATH_PROPERTY);
        if (override != null && !override.isEmpty()) {
            try {
                return fromFile(Paths.get(override));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + override, e);
            }
        }
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", RESOURCE);
                return defaults();
            }
            return fromReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classpath resource " + RESOURCE, e);
        }
    }

    public static EngineConfig fromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            EngineConfig config = fromReader(reader);
            logger.info("Loaded engine configuration from {}", path);
            return config;
        }
    }

    public static EngineConfig fromReader(Reader reader) {
        EngineConfig config = GSON.fromJson(reader, EngineConfig.class);
        if (config == null) {
            return defaults();
        }
        config.validate();
        return config;
    }

    private void validate() {
        if (gammaFloor <= 0) throw new JsonParseException("gammaFloor must be > 0");
        if (maxKernelSize < 1) throw new JsonParseException("maxKernelSize must be >= 1");
        if (maxScaleFactor < 1) throw new JsonParseException("maxScaleFactor must be >= 1");
        if (maxPaletteColors < 1) throw new JsonParseException("maxPaletteColors must be >= 1");
        if (paletteSampleSize < 1) throw new JsonParseException("paletteSampleSize must be >= 1");
        if (paletteMaxIterations < 1) throw new JsonParseException("paletteMaxIterations must be >= 1");
        if (paletteAttempts < 1) throw new JsonParseException("paletteAttempts must be >= 1");
    }

    public double getGammaFloor() {
        return gammaFloor;
    }

    public double getSobelColorThreshold() {
        return sobelColorThreshold;
    }

    public int getMaxKernelSize() {
        return maxKernelSize;
    }

    public int getMaxScaleFactor() {
        return maxScaleFactor;
    }

    public int getMaxPaletteColors() {
        return maxPaletteColors;
    }

    public int getPaletteSampleSize() {
        return paletteSampleSize;
    }

    public int getPaletteMaxIterations() {
        return paletteMaxIterations;
    }

    public double getPaletteEpsilon() {
        return paletteEpsilon;
    }

    public int getPaletteAttempts() {
        return paletteAttempts;
    }

    public int getPaletteSeed() {
        return paletteSeed;
    }

    public boolean isPaletteSeeded() {
        return paletteSeed >= 0;
    }

    @Override
    public String toString() {
        return GSON.toJson(this);
    }
}
