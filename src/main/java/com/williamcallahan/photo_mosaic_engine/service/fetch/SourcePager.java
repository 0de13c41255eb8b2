package com.williamcallahan.photo_mosaic_engine.service.fetch;

import com.williamcallahan.photo_mosaic_engine.exception.SourceUnavailableException;
import com.williamcallahan.photo_mosaic_engine.model.ListingPage;
import com.williamcallahan.photo_mosaic_engine.service.listing.ListingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a paginated listing one page at a time for a single fetch run.
 * <p>
 * The pager becomes exhausted when the source stops returning a cursor, returns the cursor it was
 * just given, or the page budget is spent. Not thread-safe; it is driven by one aggregator thread.
 */
public class SourcePager {

    private static final Logger logger = LoggerFactory.getLogger(SourcePager.class);

    private final ListingSource source;
    private final String topic;
    private final int maxPages;

    private String cursor;
    private boolean exhausted;
    private int pagesRequested;

    public SourcePager(ListingSource source, String topic, int maxPages) {
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
        }
        this.source = source;
        this.topic = topic;
        this.maxPages = maxPages;
    }

    /**
     * Requests the page at the current cursor and advances.
     *
     * @throws IllegalStateException      if the pager is already exhausted
     * @throws SourceUnavailableException if the listing call fails; the cursor is left unchanged
     */
    public ListingPage nextPage() {
        if (exhausted) {
            throw new IllegalStateException("Listing for '" + topic + "' is exhausted");
        }
        ListingPage page = source.listPage(topic, cursor);
        pagesRequested++;

        String next = page.nextCursor();
        if (next == null) {
            exhausted = true;
            logger.debug("Listing for '{}' has no further pages after {} page(s)", topic, pagesRequested);
        } else if (next.equals(cursor)) {
            exhausted = true;
            logger.warn("Listing for '{}' returned its own cursor '{}'; treating as exhausted", topic, next);
        } else if (pagesRequested >= maxPages) {
            exhausted = true;
            logger.info("Listing for '{}' reached the page limit of {}", topic, maxPages);
        }
        cursor = next;
        return page;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public int getPagesRequested() {
        return pagesRequested;
    }

    public String getTopic() {
        return topic;
    }
}
