package com.williamcallahan.photo_mosaic_engine.controller;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.photo_mosaic_engine.model.MosaicRequest;
import com.williamcallahan.photo_mosaic_engine.service.image.CachingImageLoader;
import com.williamcallahan.photo_mosaic_engine.service.image.MosaicImageEncoder;
import com.williamcallahan.photo_mosaic_engine.service.mosaic.MosaicService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP surface for mosaic generation
 *
 * @author William Callahan
 *
 * Features:
 * - Generates a mosaic for an input image URL and returns it as PNG
 * - Accepts the tile topic, tile count, tile size and matching strategy as optional overrides
 * - Exposes image cache statistics for diagnostics
 * - Errors are translated by MosaicExceptionHandler
 */
@RestController
@Slf4j
public class MosaicController {

    private final MosaicService mosaicService;
    private final MosaicImageEncoder mosaicImageEncoder;
    private final CachingImageLoader cachingImageLoader;

    public MosaicController(MosaicService mosaicService,
                            MosaicImageEncoder mosaicImageEncoder,
                            CachingImageLoader cachingImageLoader) {
        this.mosaicService = mosaicService;
        this.mosaicImageEncoder = mosaicImageEncoder;
        this.cachingImageLoader = cachingImageLoader;
    }

    /**
     * Generate a mosaic
     *
     * @param inputImageUrl image to rebuild out of tiles
     * @param tileSource    listing topic to pull tiles from, e.g. a subreddit name
     * @param numSamples    number of tiles to collect
     * @param tileSize      edge length of every tile in pixels
     * @param strategy      {@code color} or {@code image-variance}
     * @return PNG bytes of the finished mosaic
     */
    @RequestMapping(value = "/generate", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<byte[]> generate(@RequestParam String inputImageUrl,
                                           @RequestParam(required = false) String tileSource,
                                           @RequestParam(required = false) Integer numSamples,
                                           @RequestParam(required = false) Integer tileSize,
                                           @RequestParam(required = false) String strategy) {
        MosaicRequest request = mosaicService.resolveRequest(inputImageUrl, tileSource, numSamples, tileSize, strategy);
        log.debug("Resolved mosaic request: {}", request);

        BufferedImage mosaic = mosaicService.generate(request);
        byte[] png = mosaicImageEncoder.encodePng(mosaic);
        return ResponseEntity.ok()
            .contentType(MediaType.IMAGE_PNG)
            .cacheControl(CacheControl.noStore())
            .body(png);
    }

    /**
     * Report the state of the image cache
     *
     * @return entry count and hit/miss statistics
     */
    @GetMapping(value = "/cached", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> cached() {
        CacheStats stats = cachingImageLoader.stats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", cachingImageLoader.isCacheEnabled());
        body.put("estimatedSize", cachingImageLoader.estimatedSize());
        body.put("hitCount", stats.hitCount());
        body.put("missCount", stats.missCount());
        body.put("hitRate", stats.hitRate());
        body.put("loadFailureCount", stats.loadFailureCount());
        body.put("evictionCount", stats.evictionCount());
        return ResponseEntity.ok(body);
    }
}
