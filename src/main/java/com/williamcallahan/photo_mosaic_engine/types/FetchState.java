package com.williamcallahan.photo_mosaic_engine.types;

/**
 * States of a single tile fetch run.
 */
public enum FetchState {
    /** Requesting the next listing page. */
    PAGING,
    /** Handing the current page's candidates to idle workers. */
    DISPATCHING,
    /** Source exhausted; waiting for in-flight jobs before deciding the outcome. */
    DRAINING,
    /** Target reached. */
    DONE,
    /** Listing failure or too few usable candidates. */
    FAILED
}
