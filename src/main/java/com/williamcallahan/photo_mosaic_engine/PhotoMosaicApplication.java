/**
 * Main application class for the Photo Mosaic Engine
 *
 * @author William Callahan
 *
 * Features:
 * - Serves mosaic generation over HTTP
 * - Pulls tiles from remote gallery listings on demand
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.photo_mosaic_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoMosaicApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        // Image decoding and resampling never touch a display
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(PhotoMosaicApplication.class, args);
    }
}
