package com.williamcallahan.photo_mosaic_engine.controller.support;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message, String detail) {
        Map<String, String> body = new HashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(errorBody(message, detail));
    }

    public static ResponseEntity<Map<String, String>> badRequest(String message, String detail) {
        return error(HttpStatus.BAD_REQUEST, message, detail);
    }
}
