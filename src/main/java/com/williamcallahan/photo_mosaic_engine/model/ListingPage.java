package com.williamcallahan.photo_mosaic_engine.model;

import java.util.List;

/**
 * One page of candidate URLs from a listing source.
 *
 * @param items      candidate image URLs in listing order
 * @param nextCursor continuation cursor for the following page, or {@code null} when the source is exhausted
 */
public record ListingPage(List<String> items, String nextCursor) {

    public ListingPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ListingPage last(List<String> items) {
        return new ListingPage(items, null);
    }

    public boolean isLastPage() {
        return nextCursor == null;
    }
}
