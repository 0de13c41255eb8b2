package com.williamcallahan.photo_mosaic_engine.exception;

/**
 * Network failure, timeout or unexpected HTTP status while downloading an image.
 */
public class ImageTransportException extends ImageLoadException {

    public ImageTransportException(String identifier, String message) {
        super(identifier, message);
    }

    public ImageTransportException(String identifier, String message, Throwable cause) {
        super(identifier, message, cause);
    }
}
