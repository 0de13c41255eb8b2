package com.williamcallahan.photo_mosaic_engine.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A fixed-size square image used as a replacement unit in the mosaic, together with its
 * precomputed average color.
 *
 * <p>The pixel buffer is never written after construction, so a tile can be read from any
 * number of composer threads.</p>
 *
 * @author William Callahan
 */
public final class Tile {

    private final BufferedImage image;
    private final ColorDescriptor descriptor;
    private final String sourceUrl;

    public Tile(BufferedImage image, ColorDescriptor descriptor, String sourceUrl) {
        this.image = Objects.requireNonNull(image, "image");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.sourceUrl = sourceUrl;
        if (image.getWidth() != image.getHeight()) {
            throw new IllegalArgumentException("Tiles must be square but was " + image.getWidth() + "x" + image.getHeight());
        }
    }

    public BufferedImage getImage() {
        return image;
    }

    public ColorDescriptor getDescriptor() {
        return descriptor;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public int getSize() {
        return image.getWidth();
    }

    @Override
    public String toString() {
        return "Tile{" + "size=" + getSize() + ", descriptor=" + descriptor + ", sourceUrl='" + sourceUrl + '\'' + '}';
    }
}
