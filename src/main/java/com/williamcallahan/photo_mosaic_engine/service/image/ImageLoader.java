package com.williamcallahan.photo_mosaic_engine.service.image;

import com.williamcallahan.photo_mosaic_engine.exception.ImageLoadException;

import java.awt.image.BufferedImage;

/**
 * Capability to turn an identifier into decoded pixels.
 * <p>
 * Implementations are composed by decoration (a cache wraps a direct source); callers do not
 * care whether the pixels came from the network, a cache, or anywhere else.
 */
public interface ImageLoader {

    /**
     * Loads and decodes one image.
     *
     * @param identifier image identifier, typically an absolute http(s) URL
     * @return the decoded image, never {@code null}
     * @throws ImageLoadException when the image is missing, is not an image, cannot be decoded,
     *                            or the transport fails
     */
    BufferedImage loadImage(String identifier);
}
