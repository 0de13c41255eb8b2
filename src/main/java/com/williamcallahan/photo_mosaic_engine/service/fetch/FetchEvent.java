package com.williamcallahan.photo_mosaic_engine.service.fetch;

import com.williamcallahan.photo_mosaic_engine.model.FetchJob;
import com.williamcallahan.photo_mosaic_engine.model.Tile;

/**
 * Message posted by a fetch worker to the aggregator mailbox.
 */
record FetchEvent(Kind kind, FetchJob job, Tile tile, RuntimeException error) {

    enum Kind {
        /** The worker is about to wait for its next job. */
        WORKER_READY,
        SUCCEEDED,
        FAILED
    }

    static FetchEvent workerReady() {
        return new FetchEvent(Kind.WORKER_READY, null, null, null);
    }

    static FetchEvent succeeded(FetchJob job, Tile tile) {
        return new FetchEvent(Kind.SUCCEEDED, job, tile, null);
    }

    static FetchEvent failed(FetchJob job, RuntimeException error) {
        return new FetchEvent(Kind.FAILED, job, null, error);
    }
}
