package com.williamcallahan.photo_mosaic_engine.exception;

/**
 * The response declared a content type that is not {@code image/*}.
 */
public class NotAnImageException extends ImageLoadException {

    private final String contentType;

    public NotAnImageException(String identifier, String contentType) {
        super(identifier, "The response was not an image: " + contentType);
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }
}
