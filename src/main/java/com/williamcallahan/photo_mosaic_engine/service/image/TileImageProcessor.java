package com.williamcallahan.photo_mosaic_engine.service.image;

import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import com.williamcallahan.photo_mosaic_engine.model.ColorDescriptor;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.util.ColorProfiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * Turns an arbitrary decoded image into a square tile of a fixed size.
 * The largest centered square is cropped first, so tiles are never stretched.
 */
@Service
public class TileImageProcessor {

    private static final Logger logger = LoggerFactory.getLogger(TileImageProcessor.class);

    private final Object interpolation;

    @Autowired
    public TileImageProcessor(MosaicConfigurationProperties properties) {
        this(properties.getTiles().getResampling());
    }

    TileImageProcessor(String resampling) {
        this.interpolation = interpolationFor(resampling);
    }

    /**
     * Crops, resamples and profiles one image.
     *
     * @param source    decoded image of any size
     * @param tileSize  edge length of the resulting tile, in pixels
     * @param sourceUrl where the image came from, kept for diagnostics
     * @return an immutable tile with its average color attached
     */
    public Tile toTile(BufferedImage source, int tileSize, String sourceUrl) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive: " + tileSize);
        }
        Rectangle square = maxSquareInRect(source.getWidth(), source.getHeight());
        BufferedImage cropped = source.getSubimage(square.x, square.y, square.width, square.height);

        BufferedImage output = new BufferedImage(tileSize, tileSize, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = output.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(cropped, 0, 0, tileSize, tileSize, null);
        } finally {
            g2d.dispose();
        }

        ColorDescriptor descriptor = ColorProfiler.averageColor(output);
        logger.trace("Resized {} from {}x{} to {}x{}, average {}", sourceUrl,
            source.getWidth(), source.getHeight(), tileSize, tileSize, descriptor);
        return new Tile(output, descriptor, sourceUrl);
    }

    /**
     * Largest square centered within a {@code width x height} rectangle
     */
    static Rectangle maxSquareInRect(int width, int height) {
        int min = Math.min(width, height);
        if (min <= 0) {
            throw new IllegalArgumentException("Image has no pixels: " + width + "x" + height);
        }
        return new Rectangle((width - min) / 2, (height - min) / 2, min, min);
    }

    private static Object interpolationFor(String resampling) {
        String value = resampling == null ? "bilinear" : resampling.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "bicubic":
                return RenderingHints.VALUE_INTERPOLATION_BICUBIC;
            case "bilinear":
                return RenderingHints.VALUE_INTERPOLATION_BILINEAR;
            default:
                throw new IllegalArgumentException("Unsupported tile resampling '" + resampling + "', expected bilinear or bicubic");
        }
    }
}
