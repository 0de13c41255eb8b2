/**
 * Pipeline-level failure of a tile fetch run
 *
 * @author William Callahan
 *
 * Features:
 * - Aborts the whole run; no partial tile set is handed to the composer
 * - Parent of the source-unavailable and insufficient-tiles cases
 */

package com.williamcallahan.photo_mosaic_engine.exception;

public class TileFetchException extends MosaicException {

    public TileFetchException(String message) {
        super(message);
    }

    public TileFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
