package com.williamcallahan.photo_mosaic_engine.exception;

/**
 * The listing source failed or returned data that could not be parsed.
 */
public class SourceUnavailableException extends TileFetchException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
