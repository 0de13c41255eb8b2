/**
 * Mosaic engine configuration properties
 * Centralizes all mosaic.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.photo_mosaic_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "mosaic")
public class MosaicConfigurationProperties {

    @NestedConfigurationProperty
    private Fetch fetch = new Fetch();

    @NestedConfigurationProperty
    private Tiles tiles = new Tiles();

    @NestedConfigurationProperty
    private Matching matching = new Matching();

    @NestedConfigurationProperty
    private Listing listing = new Listing();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Composer composer = new Composer();

    // Getters and setters
    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }

    public Tiles getTiles() { return tiles; }
    public void setTiles(Tiles tiles) { this.tiles = tiles; }

    public Matching getMatching() { return matching; }
    public void setMatching(Matching matching) { this.matching = matching; }

    public Listing getListing() { return listing; }
    public void setListing(Listing listing) { this.listing = listing; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Composer getComposer() { return composer; }
    public void setComposer(Composer composer) { this.composer = composer; }

    // Nested configuration classes
    public static class Fetch {
        private int workers = 10;
        private int targetTileCount = 100;
        private int maxTargetTileCount = 1000;
        private int maxPages = 50;
        private Duration downloadTimeout = Duration.ofSeconds(10);

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public int getTargetTileCount() { return targetTileCount; }
        public void setTargetTileCount(int targetTileCount) { this.targetTileCount = targetTileCount; }

        public int getMaxTargetTileCount() { return maxTargetTileCount; }
        public void setMaxTargetTileCount(int maxTargetTileCount) { this.maxTargetTileCount = maxTargetTileCount; }

        public int getMaxPages() { return maxPages; }
        public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

        public Duration getDownloadTimeout() { return downloadTimeout; }
        public void setDownloadTimeout(Duration downloadTimeout) { this.downloadTimeout = downloadTimeout; }
    }

    public static class Tiles {
        private int size = 25;
        private int maxSize = 200;
        private String resampling = "bilinear";

        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public String getResampling() { return resampling; }
        public void setResampling(String resampling) { this.resampling = resampling; }
    }

    public static class Matching {
        private String strategy = "color";

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    public static class Listing {
        private String provider = "reddit";
        private String topic = "pics";
        private Duration timeout = Duration.ofSeconds(10);

        @NestedConfigurationProperty
        private Reddit reddit = new Reddit();

        @NestedConfigurationProperty
        private Imgur imgur = new Imgur();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public Reddit getReddit() { return reddit; }
        public void setReddit(Reddit reddit) { this.reddit = reddit; }

        public Imgur getImgur() { return imgur; }
        public void setImgur(Imgur imgur) { this.imgur = imgur; }

        public static class Reddit {
            private String baseUrl = "https://www.reddit.com";
            private String userAgent = "linux:photo-mosaic-engine:1.0.0";

            public String getBaseUrl() { return baseUrl; }
            public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

            public String getUserAgent() { return userAgent; }
            public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
        }

        public static class Imgur {
            private String baseUrl = "https://api.imgur.com";
            private String clientId;
            private boolean useThumbnails = true;

            public String getBaseUrl() { return baseUrl; }
            public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

            public String getClientId() { return clientId; }
            public void setClientId(String clientId) { this.clientId = clientId; }

            public boolean isUseThumbnails() { return useThumbnails; }
            public void setUseThumbnails(boolean useThumbnails) { this.useThumbnails = useThumbnails; }
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private long maxEntries = 500;
        private Duration ttl = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }

    public static class Composer {
        private int parallelism = 0;

        /**
         * Thread count for cell matching; {@code <= 0} means one per available processor
         */
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }
}
