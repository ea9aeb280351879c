package com.ttennebkram.enhancer.image;

/**
 * The two pixel layouts the engine works with.
 */
public enum ImageVariant {
    /** One 8-bit intensity channel. */
    GRAY(1),
    /** Three 8-bit channels in blue, green, red order. */
    COLOR(3);

    private final int channels;

    ImageVariant(int channels) {
        this.channels = channels;
    }

    public int channels() {
        return channels;
    }
}
