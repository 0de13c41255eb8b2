package com.williamcallahan.photo_mosaic_engine.model;

/**
 * Average color of a pixel region as four unsigned 8-bit channels.
 *
 * @param red   0-255
 * @param green 0-255
 * @param blue  0-255
 * @param alpha 0-255
 */
public record ColorDescriptor(int red, int green, int blue, int alpha) {

    public ColorDescriptor {
        requireChannel("red", red);
        requireChannel("green", green);
        requireChannel("blue", blue);
        requireChannel("alpha", alpha);
    }

    /**
     * Builds a descriptor from a packed {@code 0xAARRGGBB} value as returned by {@code BufferedImage.getRGB}.
     */
    public static ColorDescriptor fromArgb(int argb) {
        return new ColorDescriptor((argb >>> 16) & 0xFF, (argb >>> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
    }

    public int toArgb() {
        return (alpha << 24) | (red << 16) | (green << 8) | blue;
    }

    private static void requireChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }
}
