package com.williamcallahan.photo_mosaic_engine.service.mosaic;

import com.williamcallahan.photo_mosaic_engine.exception.EmptyTileIndexException;
import com.williamcallahan.photo_mosaic_engine.model.ColorDescriptor;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.types.MatchingStrategy;
import com.williamcallahan.photo_mosaic_engine.util.ColorProfiler;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Immutable set of tiles answering nearest-match queries.
 * <p>
 * Queries are linear scans. Ties resolve to the tile encountered first, so results are
 * deterministic for a given tile order. Safe for concurrent queries.
 */
public final class TileIndex {

    private final List<Tile> tiles;
    private final int tileSize;

    /**
     * @throws EmptyTileIndexException if {@code tiles} is empty
     * @throws IllegalArgumentException if the tiles do not all share one size
     */
    public TileIndex(List<Tile> tiles) {
        if (tiles == null || tiles.isEmpty()) {
            throw new EmptyTileIndexException();
        }
        this.tiles = List.copyOf(tiles);
        this.tileSize = this.tiles.get(0).getSize();
        for (Tile tile : this.tiles) {
            if (tile.getSize() != tileSize) {
                throw new IllegalArgumentException("Mixed tile sizes in index: " + tileSize + " and " + tile.getSize());
            }
        }
    }

    public Tile nearestByColor(ColorDescriptor query) {
        Tile best = tiles.get(0);
        long bestDistance = ColorProfiler.colorDistance(query, best.getDescriptor());
        for (int i = 1; i < tiles.size() && bestDistance > 0; i++) {
            Tile candidate = tiles.get(i);
            long distance = ColorProfiler.colorDistance(query, candidate.getDescriptor());
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    /**
     * @param region cell pixels, sized exactly like the indexed tiles
     */
    public Tile nearestByImage(BufferedImage region) {
        Tile best = tiles.get(0);
        double bestVariance = ColorProfiler.differenceVariance(region, best.getImage());
        for (int i = 1; i < tiles.size() && bestVariance > 0; i++) {
            Tile candidate = tiles.get(i);
            double variance = ColorProfiler.differenceVariance(region, candidate.getImage());
            if (variance < bestVariance) {
                best = candidate;
                bestVariance = variance;
            }
        }
        return best;
    }

    public Tile match(BufferedImage cell, MatchingStrategy strategy) {
        return switch (strategy) {
            case COLOR -> nearestByColor(ColorProfiler.averageColor(cell));
            case IMAGE_VARIANCE -> nearestByImage(cell);
        };
    }

    public int size() {
        return tiles.size();
    }

    public int getTileSize() {
        return tileSize;
    }

    public List<Tile> getTiles() {
        return tiles;
    }
}
