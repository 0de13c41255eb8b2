package com.williamcallahan.photo_mosaic_engine;

import com.williamcallahan.photo_mosaic_engine.service.image.CachingImageLoader;
import com.williamcallahan.photo_mosaic_engine.service.image.ImageLoader;
import com.williamcallahan.photo_mosaic_engine.service.listing.ListingSourceRegistry;
import com.williamcallahan.photo_mosaic_engine.types.ListingProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke test: the full context wires without touching the network
 */
@SpringBootTest
class PhotoMosaicApplicationTests {

    @Autowired
    private ImageLoader imageLoader;

    @Autowired
    private ListingSourceRegistry listingSourceRegistry;

    @Test
    void contextLoadsWithCachedImageLoading() {
        assertThat(imageLoader).isInstanceOf(CachingImageLoader.class);
        assertThat(listingSourceRegistry.defaultSource().provider()).isEqualTo(ListingProvider.REDDIT);
    }
}
