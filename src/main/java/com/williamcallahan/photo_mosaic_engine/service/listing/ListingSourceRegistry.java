package com.williamcallahan.photo_mosaic_engine.service.listing;

import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import com.williamcallahan.photo_mosaic_engine.types.ListingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the listing source for a provider name
 *
 * @author William Callahan
 *
 * Features:
 * - Collects every ListingSource bean keyed by its provider
 * - Resolves the configured default ({@code mosaic.listing.provider}) eagerly so typos fail at startup
 */
@Component
public class ListingSourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ListingSourceRegistry.class);

    private final Map<ListingProvider, ListingSource> sources = new EnumMap<>(ListingProvider.class);
    private final ListingSource defaultSource;

    public ListingSourceRegistry(List<ListingSource> listingSources, MosaicConfigurationProperties properties) {
        for (ListingSource source : listingSources) {
            ListingSource previous = sources.put(source.provider(), source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate listing source for " + source.provider());
            }
        }
        this.defaultSource = resolve(ListingProvider.fromValue(properties.getListing().getProvider()));
        logger.info("Listing sources available: {}; default provider: {}", sources.keySet(), defaultSource.provider());
    }

    public ListingSource defaultSource() {
        return defaultSource;
    }

    public ListingSource resolve(ListingProvider provider) {
        ListingSource source = sources.get(provider);
        if (source == null) {
            throw new IllegalArgumentException("No listing source registered for " + provider);
        }
        return source;
    }
}
