package com.williamcallahan.photo_mosaic_engine.exception;

/**
 * The response body could not be decoded into pixels.
 */
public class ImageDecodeException extends ImageLoadException {

    public ImageDecodeException(String identifier, String message) {
        super(identifier, message);
    }

    public ImageDecodeException(String identifier, String message, Throwable cause) {
        super(identifier, message, cause);
    }
}
