/**
 * Downloads and decodes images over HTTP
 *
 * @author William Callahan
 *
 * Features:
 * - Uses the shared WebClient builder and its connection settings
 * - Validates the declared content type before reading the body
 * - Decodes with ImageIO and reports unsupported or corrupt data as decode failures
 * - Maps 404, other HTTP errors and timeouts to distinct exception types
 */
package com.williamcallahan.photo_mosaic_engine.service.image;

import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import com.williamcallahan.photo_mosaic_engine.exception.ImageDecodeException;
import com.williamcallahan.photo_mosaic_engine.exception.ImageLoadException;
import com.williamcallahan.photo_mosaic_engine.exception.ImageNotFoundException;
import com.williamcallahan.photo_mosaic_engine.exception.ImageTransportException;
import com.williamcallahan.photo_mosaic_engine.exception.NotAnImageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Service("webImageLoader")
public class WebImageLoader implements ImageLoader {

    private static final Logger logger = LoggerFactory.getLogger(WebImageLoader.class);

    private final WebClient webClient;
    private final Duration downloadTimeout;

    /**
     * Constructs the WebImageLoader
     * @param webClientBuilder WebClient Builder
     * @param properties mosaic configuration, read for the download timeout
     */
    public WebImageLoader(WebClient.Builder webClientBuilder, MosaicConfigurationProperties properties) {
        this.webClient = webClientBuilder.build();
        this.downloadTimeout = properties.getFetch().getDownloadTimeout();
    }

    @Override
    public BufferedImage loadImage(String identifier) {
        URI uri = toHttpUri(identifier);
        byte[] body;
        try {
            body = webClient.get()
                .uri(uri)
                .accept(MediaType.ALL)
                .exchangeToMono(response -> readImageBody(identifier, response))
                .timeout(downloadTimeout)
                .block();
        } catch (ImageLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ImageTransportException(identifier, "Timed out after " + downloadTimeout.toMillis() + " ms", cause);
            }
            throw new ImageTransportException(identifier, "Failed to download image: " + cause.getMessage(), cause);
        }

        if (body == null || body.length == 0) {
            throw new ImageDecodeException(identifier, "Response body was empty");
        }
        logger.debug("Downloaded {} bytes from {}", body.length, identifier);
        return decode(identifier, body);
    }

    private Mono<byte[]> readImageBody(String identifier, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().then(Mono.error(new ImageNotFoundException(identifier)));
        }
        if (!status.is2xxSuccessful()) {
            return response.releaseBody().then(Mono.error(
                new ImageTransportException(identifier, "Unexpected HTTP status " + status.value())));
        }
        MediaType contentType = response.headers().contentType().orElse(null);
        if (contentType == null || !"image".equalsIgnoreCase(contentType.getType())) {
            String declared = contentType == null ? "<none>" : contentType.toString();
            return response.releaseBody().then(Mono.error(new NotAnImageException(identifier, declared)));
        }
        return response.bodyToMono(byte[].class);
    }

    static BufferedImage decode(String identifier, byte[] body) {
        return decode(identifier, () -> {
            try (ByteArrayInputStream in = new ByteArrayInputStream(body)) {
                return ImageIO.read(in);
            }
        });
    }

    static BufferedImage decode(String identifier, ImageRead read) {
        BufferedImage image;
        try {
            image = read.read();
        } catch (IOException e) {
            throw new ImageDecodeException(identifier, "IOException while decoding: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Readers throw unchecked exceptions on some truncated or malformed streams
            throw new ImageDecodeException(identifier, "Decoder failed with " + e.getClass().getSimpleName(), e);
        }
        if (image == null) {
            throw new ImageDecodeException(identifier, "Unsupported or corrupt image format");
        }
        if (image.getWidth() == 0 || image.getHeight() == 0) {
            throw new ImageDecodeException(identifier, "Decoded image has no pixels");
        }
        return image;
    }

    private static URI toHttpUri(String identifier) {
        if (!StringUtils.hasText(identifier)) {
            throw new ImageNotFoundException(String.valueOf(identifier));
        }
        try {
            URI uri = URI.create(identifier.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ImageTransportException(identifier, "Only http and https image URLs are supported");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ImageTransportException(identifier, "Malformed image URL", e);
        }
    }

    @FunctionalInterface
    interface ImageRead {
        BufferedImage read() throws IOException;
    }
}
