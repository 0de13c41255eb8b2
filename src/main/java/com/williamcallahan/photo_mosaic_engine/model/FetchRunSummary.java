package com.williamcallahan.photo_mosaic_engine.model;

import java.util.List;

/**
 * Outcome of a completed tile fetch run.
 *
 * @param tiles          collected tiles in success-arrival order
 * @param pagesRequested listing pages requested during the run
 * @param submitted      jobs handed to the worker pool
 * @param failed         jobs that reported a failure before the run completed
 * @param abandoned      jobs still in flight when the target was reached; their results are discarded
 */
public record FetchRunSummary(List<Tile> tiles, int pagesRequested, int submitted, int failed, int abandoned) {

    public FetchRunSummary {
        tiles = List.copyOf(tiles);
    }
}
