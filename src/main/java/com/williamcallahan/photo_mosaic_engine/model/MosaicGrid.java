package com.williamcallahan.photo_mosaic_engine.model;

/**
 * Geometry of a mosaic canvas: {@code numTilesX x numTilesY} cells of {@code tileSize} pixels.
 * Any remainder of the source image beyond the last full cell is cropped.
 */
public record MosaicGrid(int numTilesX, int numTilesY, int tileSize) {

    public MosaicGrid {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive: " + tileSize);
        }
        if (numTilesX < 0 || numTilesY < 0) {
            throw new IllegalArgumentException("Grid dimensions must not be negative");
        }
    }

    public static MosaicGrid forImage(int imageWidth, int imageHeight, int tileSize) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive: " + tileSize);
        }
        return new MosaicGrid(imageWidth / tileSize, imageHeight / tileSize, tileSize);
    }

    public int width() {
        return numTilesX * tileSize;
    }

    public int height() {
        return numTilesY * tileSize;
    }

    public int cellCount() {
        return numTilesX * numTilesY;
    }

    public boolean isEmpty() {
        return cellCount() == 0;
    }
}
