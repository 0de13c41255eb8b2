/**
 * Builds the mosaic canvas from a source image and a tile index
 *
 * @author William Callahan
 *
 * Features:
 * - Divides the source into a grid of full tile-sized cells and crops the remainder
 * - Matches cells concurrently on the composer executor
 * - Each cell writes a disjoint region of the canvas
 * - Leaves the source image untouched
 */
package com.williamcallahan.photo_mosaic_engine.service.mosaic;

import com.williamcallahan.photo_mosaic_engine.exception.MosaicException;
import com.williamcallahan.photo_mosaic_engine.model.MosaicGrid;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.types.MatchingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
public class MosaicComposer {

    private static final Logger logger = LoggerFactory.getLogger(MosaicComposer.class);

    private final Executor composerExecutor;

    @Autowired
    public MosaicComposer(@Qualifier("mosaicComposerExecutor") AsyncTaskExecutor composerExecutor) {
        this.composerExecutor = composerExecutor;
    }

    MosaicComposer(Executor composerExecutor) {
        this.composerExecutor = composerExecutor;
    }

    /**
     * Replaces every full cell of {@code source} with its best-matching tile.
     *
     * @return a new ARGB canvas of {@code floor(w/T)*T x floor(h/T)*T} pixels
     * @throws IllegalArgumentException if the source is smaller than one tile in either dimension,
     *                                  or the tile size differs from the index
     */
    public BufferedImage compose(BufferedImage source, TileIndex index, int tileSize, MatchingStrategy strategy) {
        if (tileSize != index.getTileSize()) {
            throw new IllegalArgumentException("Tile size " + tileSize + " does not match indexed tiles of " + index.getTileSize());
        }
        MosaicGrid grid = MosaicGrid.forImage(source.getWidth(), source.getHeight(), tileSize);
        if (grid.isEmpty()) {
            throw new IllegalArgumentException(String.format("Input image %dx%d is smaller than one %dpx tile",
                source.getWidth(), source.getHeight(), tileSize));
        }

        BufferedImage canvas = new BufferedImage(grid.width(), grid.height(), BufferedImage.TYPE_INT_ARGB);
        long start = System.currentTimeMillis();

        List<CompletableFuture<Void>> cells = new ArrayList<>(grid.cellCount());
        for (int row = 0; row < grid.numTilesY(); row++) {
            for (int col = 0; col < grid.numTilesX(); col++) {
                int x = col * tileSize;
                int y = row * tileSize;
                cells.add(CompletableFuture.runAsync(() -> fillCell(source, canvas, index, x, y, tileSize, strategy), composerExecutor));
            }
        }

        try {
            CompletableFuture.allOf(cells.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new MosaicException("Mosaic composition failed: " + cause.getMessage(), cause);
        }

        logger.info("Composed {}x{} mosaic ({} cells, {} tiles, strategy {}) in {} ms",
            canvas.getWidth(), canvas.getHeight(), grid.cellCount(), index.size(),
            strategy.getConfigValue(), System.currentTimeMillis() - start);
        return canvas;
    }

    private static void fillCell(BufferedImage source, BufferedImage canvas, TileIndex index,
                                 int x, int y, int tileSize, MatchingStrategy strategy) {
        BufferedImage cell = source.getSubimage(x, y, tileSize, tileSize);
        Tile tile = index.match(cell, strategy);
        int[] pixels = tile.getImage().getRGB(0, 0, tileSize, tileSize, null, 0, tileSize);
        canvas.setRGB(x, y, tileSize, tileSize, pixels, 0, tileSize);
    }
}
