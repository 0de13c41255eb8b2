/**
 * Raised when a single image cannot be loaded from its source
 *
 * @author William Callahan
 *
 * Features:
 * - Carries the identifier that failed so per-job failures can be reported
 * - Local to one fetch job; never aborts a fetch run by itself
 */

package com.williamcallahan.photo_mosaic_engine.exception;

public class ImageLoadException extends MosaicException {

    private final String identifier;

    public ImageLoadException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public ImageLoadException(String identifier, String message, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
