package com.williamcallahan.photo_mosaic_engine.exception;

public class ImageNotFoundException extends ImageLoadException {

    public ImageNotFoundException(String identifier) {
        super(identifier, "Image not found: " + identifier);
    }
}
