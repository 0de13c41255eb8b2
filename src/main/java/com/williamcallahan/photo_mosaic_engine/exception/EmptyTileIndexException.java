package com.williamcallahan.photo_mosaic_engine.exception;

/**
 * A tile index was built from zero tiles. This is a configuration or programming error
 * and is rejected when the index is constructed, never at query time.
 */
public class EmptyTileIndexException extends MosaicException {

    public EmptyTileIndexException() {
        super("Cannot build a tile index without tiles");
    }
}
