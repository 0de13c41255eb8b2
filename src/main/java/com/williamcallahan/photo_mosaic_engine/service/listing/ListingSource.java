package com.williamcallahan.photo_mosaic_engine.service.listing;

import com.williamcallahan.photo_mosaic_engine.exception.SourceUnavailableException;
import com.williamcallahan.photo_mosaic_engine.model.ListingPage;
import com.williamcallahan.photo_mosaic_engine.types.ListingProvider;

/**
 * A remote, paginated listing of candidate tile images.
 */
public interface ListingSource {

    ListingProvider provider();

    /**
     * Requests one page of the listing.
     *
     * @param topic  listing topic, e.g. a subreddit or gallery tag
     * @param cursor continuation cursor returned with the previous page, or {@code null} for the first page
     * @return candidate URLs and the cursor of the following page ({@code null} when exhausted)
     * @throws SourceUnavailableException if the remote call fails or the payload lacks its critical fields
     */
    ListingPage listPage(String topic, String cursor);
}
