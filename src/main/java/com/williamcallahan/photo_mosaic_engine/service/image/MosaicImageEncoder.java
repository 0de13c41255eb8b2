package com.williamcallahan.photo_mosaic_engine.service.image;

import com.williamcallahan.photo_mosaic_engine.exception.MosaicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Encodes a finished mosaic canvas into a lossless container format
 */
@Service
public class MosaicImageEncoder {

    private static final Logger logger = LoggerFactory.getLogger(MosaicImageEncoder.class);

    public static final String PNG_MIME_TYPE = "image/png";

    public byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", baos)) {
                throw new MosaicException("No PNG ImageWriter available");
            }
            byte[] bytes = baos.toByteArray();
            logger.debug("Encoded {}x{} mosaic as PNG ({} bytes)", image.getWidth(), image.getHeight(), bytes.length);
            return bytes;
        } catch (IOException e) {
            throw new MosaicException("Failed to encode mosaic as PNG: " + e.getMessage(), e);
        }
    }
}
