package com.ttennebkram.enhancer.image;

import java.util.Locale;

/**
 * Encodings the codec can produce.
 */
public enum OutputFormat {
    PNG(".png"),
    JPEG(".jpg"),
    WEBP(".webp");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Pick the format from a file name's extension.
     *
     * @throws IllegalArgumentException if the extension is not recognised
     */
    public static OutputFormat fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) return PNG;
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return JPEG;
        if (lower.endsWith(".webp")) return WEBP;
        throw new IllegalArgumentException("Unsupported output file type: " + fileName);
    }
}
