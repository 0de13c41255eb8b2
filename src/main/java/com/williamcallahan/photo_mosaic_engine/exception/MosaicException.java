/**
 * Base type for every failure raised while generating a mosaic
 *
 * @author William Callahan
 *
 * Features:
 * - Unchecked so failures propagate through worker and composer lambdas
 * - Lets the web layer translate the whole family in one place
 */

package com.williamcallahan.photo_mosaic_engine.exception;

public class MosaicException extends RuntimeException {

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}
