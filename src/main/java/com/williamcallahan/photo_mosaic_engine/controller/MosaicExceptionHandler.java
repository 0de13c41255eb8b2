package com.williamcallahan.photo_mosaic_engine.controller;

import com.williamcallahan.photo_mosaic_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.photo_mosaic_engine.exception.ImageLoadException;
import com.williamcallahan.photo_mosaic_engine.exception.InsufficientTilesException;
import com.williamcallahan.photo_mosaic_engine.exception.MosaicException;
import com.williamcallahan.photo_mosaic_engine.exception.SourceUnavailableException;
import com.williamcallahan.photo_mosaic_engine.exception.TileFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Translates mosaic failures into JSON error responses
 *
 * @author William Callahan
 *
 * Features:
 * - Bad input images and invalid parameters map to 400
 * - Too few usable tiles maps to 422 with the fetch counters in the message
 * - Listing failures map to 502, other fetch failures to 503
 */
@RestControllerAdvice
@Slf4j
public class MosaicExceptionHandler {

    @ExceptionHandler(ImageLoadException.class)
    public ResponseEntity<Map<String, String>> handleInputImage(ImageLoadException ex) {
        log.info("Rejecting input image {}: {}", ex.getIdentifier(), ex.getMessage());
        return ErrorResponseUtils.badRequest("Invalid input image", ex.getMessage());
    }

    @ExceptionHandler(InsufficientTilesException.class)
    public ResponseEntity<Map<String, String>> handleInsufficientTiles(InsufficientTilesException ex) {
        return ErrorResponseUtils.error(HttpStatus.UNPROCESSABLE_ENTITY, "Not enough tiles", ex.getMessage());
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleSourceUnavailable(SourceUnavailableException ex) {
        return ErrorResponseUtils.error(HttpStatus.BAD_GATEWAY, "Tile source unavailable", ex.getMessage());
    }

    @ExceptionHandler(TileFetchException.class)
    public ResponseEntity<Map<String, String>> handleTileFetch(TileFetchException ex) {
        log.warn("Tile fetch failed: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.SERVICE_UNAVAILABLE, "Tile fetch failed", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleValidation(IllegalArgumentException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getParameterName() + " is required");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getName() + " has an invalid value: " + ex.getValue());
    }

    @ExceptionHandler(MosaicException.class)
    public ResponseEntity<Map<String, String>> handleMosaic(MosaicException ex) {
        log.error("Mosaic generation failed", ex);
        return ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Mosaic generation failed", ex.getMessage());
    }
}
