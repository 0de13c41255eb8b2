package com.williamcallahan.photo_mosaic_engine.model;

import com.williamcallahan.photo_mosaic_engine.types.MatchingStrategy;

/**
 * Fully resolved parameters of one mosaic generation.
 *
 * @param inputImageUrl   image to turn into a mosaic
 * @param topic           listing topic (subreddit or gallery tag) that tiles are pulled from
 * @param targetTileCount number of tiles to collect before matching
 * @param tileSize        edge length of every tile and grid cell, in pixels
 * @param strategy        how each cell is matched against the tile index
 */
public record MosaicRequest(String inputImageUrl, String topic, int targetTileCount, int tileSize, MatchingStrategy strategy) {
}
