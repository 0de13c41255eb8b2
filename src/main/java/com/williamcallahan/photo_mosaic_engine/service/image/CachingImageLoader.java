package com.williamcallahan.photo_mosaic_engine.service.image;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Duration;

/**
 * Get-or-populate Caffeine cache in front of another {@link ImageLoader}
 * - Keys are image identifiers; values are decoded images
 * - Bounded by entry count and expires entries after write
 * - Failed loads are never cached, so the next request retries the wrapped source
 * - When disabled by configuration every call goes straight to the wrapped source
 *
 * @author William Callahan
 */
@Service
@Primary
public class CachingImageLoader implements ImageLoader {

    private static final Logger logger = LoggerFactory.getLogger(CachingImageLoader.class);

    private final ImageLoader delegate;
    private final boolean cacheEnabled;
    private final Cache<String, BufferedImage> imageCache;

    @Autowired
    public CachingImageLoader(@Qualifier("webImageLoader") ImageLoader delegate,
                              MosaicConfigurationProperties properties) {
        this(delegate,
             properties.getCache().isEnabled(),
             properties.getCache().getMaxEntries(),
             properties.getCache().getTtl());
    }

    CachingImageLoader(ImageLoader delegate, boolean cacheEnabled, long maxEntries, Duration ttl) {
        this.delegate = delegate;
        this.cacheEnabled = cacheEnabled;
        this.imageCache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        if (!cacheEnabled) {
            logger.info("Image caching is disabled by configuration");
        }
    }

    @Override
    public BufferedImage loadImage(String identifier) {
        if (!cacheEnabled || identifier == null) {
            return delegate.loadImage(identifier);
        }
        return imageCache.get(identifier, key -> {
            logger.debug("Image cache miss for {}", key);
            return delegate.loadImage(key);
        });
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long estimatedSize() {
        return imageCache.estimatedSize();
    }

    public CacheStats stats() {
        return imageCache.stats();
    }

    /**
     * Drops every cached image
     */
    public void invalidateAll() {
        imageCache.invalidateAll();
    }
}
