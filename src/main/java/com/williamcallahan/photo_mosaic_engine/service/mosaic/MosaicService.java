/**
 * Orchestrates one mosaic generation from request to finished canvas
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves request parameters against configured defaults and limits
 * - Loads the input image before any tiles are fetched, failing fast on bad input
 * - Pages the configured listing source and collects tiles through the fetch aggregator
 * - Builds the tile index and composes the mosaic
 */
package com.williamcallahan.photo_mosaic_engine.service.mosaic;

import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import com.williamcallahan.photo_mosaic_engine.model.FetchRunSummary;
import com.williamcallahan.photo_mosaic_engine.model.MosaicGrid;
import com.williamcallahan.photo_mosaic_engine.model.MosaicRequest;
import com.williamcallahan.photo_mosaic_engine.service.fetch.FetchAggregator;
import com.williamcallahan.photo_mosaic_engine.service.fetch.SourcePager;
import com.williamcallahan.photo_mosaic_engine.service.image.ImageLoader;
import com.williamcallahan.photo_mosaic_engine.service.listing.ListingSource;
import com.williamcallahan.photo_mosaic_engine.service.listing.ListingSourceRegistry;
import com.williamcallahan.photo_mosaic_engine.types.MatchingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.awt.image.BufferedImage;

@Service
public class MosaicService {

    private static final Logger logger = LoggerFactory.getLogger(MosaicService.class);

    private final ImageLoader imageLoader;
    private final ListingSourceRegistry listingSourceRegistry;
    private final FetchAggregator fetchAggregator;
    private final MosaicComposer mosaicComposer;
    private final MosaicConfigurationProperties properties;

    public MosaicService(ImageLoader imageLoader,
                         ListingSourceRegistry listingSourceRegistry,
                         FetchAggregator fetchAggregator,
                         MosaicComposer mosaicComposer,
                         MosaicConfigurationProperties properties) {
        this.imageLoader = imageLoader;
        this.listingSourceRegistry = listingSourceRegistry;
        this.fetchAggregator = fetchAggregator;
        this.mosaicComposer = mosaicComposer;
        this.properties = properties;
    }

    /**
     * Fills unspecified parameters from configuration and validates the result
     *
     * @param inputImageUrl   required image URL
     * @param topic           listing topic, or {@code null} for the configured default
     * @param targetTileCount tiles to collect, or {@code null} for the configured default
     * @param tileSize        tile edge in pixels, or {@code null} for the configured default
     * @param strategy        matching strategy name, or {@code null} for the configured default
     * @throws IllegalArgumentException if any value is missing, malformed or outside the configured limits
     */
    public MosaicRequest resolveRequest(String inputImageUrl, String topic, Integer targetTileCount,
                                        Integer tileSize, String strategy) {
        if (!StringUtils.hasText(inputImageUrl)) {
            throw new IllegalArgumentException("inputImageUrl is required");
        }
        String resolvedTopic = StringUtils.hasText(topic) ? topic.trim() : properties.getListing().getTopic();
        if (!StringUtils.hasText(resolvedTopic)) {
            throw new IllegalArgumentException("A tile source topic is required");
        }

        int count = targetTileCount != null ? targetTileCount : properties.getFetch().getTargetTileCount();
        int maxCount = properties.getFetch().getMaxTargetTileCount();
        if (count <= 0 || count > maxCount) {
            throw new IllegalArgumentException("numSamples must be between 1 and " + maxCount + " but was " + count);
        }

        int size = tileSize != null ? tileSize : properties.getTiles().getSize();
        int maxSize = properties.getTiles().getMaxSize();
        if (size <= 0 || size > maxSize) {
            throw new IllegalArgumentException("tileSize must be between 1 and " + maxSize + " but was " + size);
        }

        MatchingStrategy resolvedStrategy = MatchingStrategy.fromValue(
            StringUtils.hasText(strategy) ? strategy : properties.getMatching().getStrategy());

        return new MosaicRequest(inputImageUrl.trim(), resolvedTopic, count, size, resolvedStrategy);
    }

    /**
     * Generates the mosaic for a resolved request on the calling thread
     *
     * @return the composed canvas; the input image is never modified
     */
    public BufferedImage generate(MosaicRequest request) {
        long start = System.currentTimeMillis();
        logger.info("Generating mosaic for {} from '{}' ({} tiles, {}px, {})", request.inputImageUrl(),
            request.topic(), request.targetTileCount(), request.tileSize(), request.strategy().getConfigValue());

        BufferedImage input = imageLoader.loadImage(request.inputImageUrl());
        MosaicGrid grid = MosaicGrid.forImage(input.getWidth(), input.getHeight(), request.tileSize());
        if (grid.isEmpty()) {
            throw new IllegalArgumentException(String.format("Input image %dx%d is smaller than one %dpx tile",
                input.getWidth(), input.getHeight(), request.tileSize()));
        }

        ListingSource source = listingSourceRegistry.defaultSource();
        SourcePager pager = new SourcePager(source, request.topic(), properties.getFetch().getMaxPages());
        FetchRunSummary fetchRun = fetchAggregator.collect(pager, request.targetTileCount(), request.tileSize());

        TileIndex index = new TileIndex(fetchRun.tiles());
        BufferedImage mosaic = mosaicComposer.compose(input, index, request.tileSize(), request.strategy());

        logger.info("Mosaic for {} ready: {}x{} from {} tiles in {} ms", request.inputImageUrl(),
            mosaic.getWidth(), mosaic.getHeight(), index.size(), System.currentTimeMillis() - start);
        return mosaic;
    }
}
