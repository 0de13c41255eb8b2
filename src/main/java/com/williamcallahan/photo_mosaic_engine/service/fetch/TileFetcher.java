package com.williamcallahan.photo_mosaic_engine.service.fetch;

import com.williamcallahan.photo_mosaic_engine.exception.ImageLoadException;
import com.williamcallahan.photo_mosaic_engine.model.FetchJob;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.service.image.ImageLoader;
import com.williamcallahan.photo_mosaic_engine.service.image.TileImageProcessor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Executes one fetch job: load the candidate image, then turn it into a tile.
 */
@Service
public class TileFetcher {

    private final ImageLoader imageLoader;
    private final TileImageProcessor tileImageProcessor;

    public TileFetcher(ImageLoader imageLoader, TileImageProcessor tileImageProcessor) {
        this.imageLoader = imageLoader;
        this.tileImageProcessor = tileImageProcessor;
    }

    /**
     * @throws ImageLoadException if the candidate cannot be loaded
     */
    public Tile fetch(FetchJob job, int tileSize) {
        BufferedImage image = imageLoader.loadImage(job.url());
        return tileImageProcessor.toTile(image, tileSize, job.url());
    }
}
