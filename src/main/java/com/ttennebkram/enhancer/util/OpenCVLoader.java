package com.ttennebkram.enhancer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV native library once per JVM.
 * Safe to call from any thread, any number of times.
 */
public final class OpenCVLoader {

    private static final Logger logger = LoggerFactory.getLogger(OpenCVLoader.class);

    private static volatile boolean loaded = false;

    private OpenCVLoader() {
    }

    public static void ensureLoaded() {
        if (loaded) return;
        synchronized (OpenCVLoader.class) {
            if (loaded) return;
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            logger.debug("OpenCV native library loaded ({})", org.opencv.core.Core.VERSION);
        }
    }
}
