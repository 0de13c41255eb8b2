package com.williamcallahan.photo_mosaic_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to external listing APIs.
 *
 * These logs help debug the tile fetch flow:
 * - Listing page requests (Reddit, Imgur)
 * - Page results and cursors
 * - Listing failures that abort a fetch run
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log a listing page request
     */
    public static void logListingAttempt(Logger log, String apiName, String topic, String cursor) {
        log.info("{} [{}] ATTEMPT: LIST_PAGE topic='{}' cursor='{}'",
            PREFIX, apiName, topic, cursor == null ? "<start>" : cursor);
    }

    /**
     * Log a listing page success
     */
    public static void logListingSuccess(Logger log, String apiName, String topic, int itemCount, String nextCursor) {
        log.info("{} [{}] SUCCESS: LIST_PAGE returned {} candidate(s) for topic='{}', next='{}'",
            PREFIX, apiName, itemCount, topic, nextCursor == null ? "<exhausted>" : nextCursor);
    }

    /**
     * Log a listing failure
     */
    public static void logListingFailure(Logger log, String apiName, String topic, String url, String reason) {
        log.warn("{} [{}] FAILURE: LIST_PAGE failed for topic='{}' url={} - {}", PREFIX, apiName, topic, url, reason);
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url) {
        log.debug("{} [HTTP] {} request to: {}", PREFIX, method, url);
    }

    /**
     * Log fetch progress
     */
    public static void logFetchProgress(Logger log, int currentCount, int targetCount) {
        log.debug("{} [FETCH] {}/{} tiles collected", PREFIX, currentCount, targetCount);
    }
}
