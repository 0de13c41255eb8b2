/**
 * Collects a target number of tiles from a paginated listing using a bounded worker pool
 *
 * @author William Callahan
 *
 * Features:
 * - Single coordinating thread reads one mailbox of worker events in arrival order
 * - Hands out one job per idle worker, so at most one job per worker is ever outstanding
 * - Requests a new page only when the current one is spent and in-flight jobs cannot reach the target
 * - Drains in-flight jobs after the listing is exhausted before deciding success or failure
 * - Reports pages, submissions, failures and abandoned jobs in the run summary
 */
package com.williamcallahan.photo_mosaic_engine.service.fetch;

import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import com.williamcallahan.photo_mosaic_engine.exception.InsufficientTilesException;
import com.williamcallahan.photo_mosaic_engine.exception.SourceUnavailableException;
import com.williamcallahan.photo_mosaic_engine.exception.TileFetchException;
import com.williamcallahan.photo_mosaic_engine.model.FetchJob;
import com.williamcallahan.photo_mosaic_engine.model.FetchRunSummary;
import com.williamcallahan.photo_mosaic_engine.model.ListingPage;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.types.FetchState;
import com.williamcallahan.photo_mosaic_engine.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class FetchAggregator {

    private static final Logger logger = LoggerFactory.getLogger(FetchAggregator.class);

    private final TileFetcher tileFetcher;
    private final int workerCount;
    private final Duration shutdownGrace;
    private final AtomicInteger runCounter = new AtomicInteger();

    @Autowired
    public FetchAggregator(TileFetcher tileFetcher, MosaicConfigurationProperties properties) {
        this(tileFetcher,
             properties.getFetch().getWorkers(),
             properties.getFetch().getDownloadTimeout().plusSeconds(5));
    }

    FetchAggregator(TileFetcher tileFetcher, int workerCount, Duration shutdownGrace) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("mosaic.fetch.workers must be positive: " + workerCount);
        }
        this.tileFetcher = tileFetcher;
        this.workerCount = workerCount;
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Runs one fetch to completion on the calling thread.
     *
     * @param pager     fresh pager over the listing to draw candidates from
     * @param target    number of tiles to collect
     * @param tileSize  edge length of every produced tile
     * @return exactly {@code target} tiles in the order their fetches succeeded, plus run counters
     * @throws IllegalArgumentException    if {@code target} or {@code tileSize} is not positive
     * @throws SourceUnavailableException  if a listing page cannot be retrieved
     * @throws InsufficientTilesException  if the listing runs out before {@code target} tiles succeed
     * @throws TileFetchException          if the calling thread is interrupted
     */
    public FetchRunSummary collect(SourcePager pager, int target, int tileSize) {
        if (target <= 0) {
            throw new IllegalArgumentException("Target tile count must be positive: " + target);
        }
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive: " + tileSize);
        }
        return new FetchRun(pager, target, tileSize, String.valueOf(runCounter.incrementAndGet())).execute();
    }

    /**
     * State of one collect call; only ever touched by the calling thread.
     */
    private final class FetchRun {

        private final SourcePager pager;
        private final int target;
        private final String runName;
        private final BlockingQueue<FetchEvent> mailbox = new LinkedBlockingQueue<>();
        private final FetchWorkerPool pool;

        private final List<Tile> tiles = new ArrayList<>();
        private final Deque<String> pendingCandidates = new ArrayDeque<>();
        private FetchState state = FetchState.PAGING;
        private int idleWorkers;
        private int inFlight;
        private int submitted;
        private int failed;

        FetchRun(SourcePager pager, int target, int tileSize, String runName) {
            this.pager = pager;
            this.target = target;
            this.runName = runName;
            this.pool = new FetchWorkerPool(runName, workerCount, tileFetcher, tileSize, mailbox, shutdownGrace);
        }

        FetchRunSummary execute() {
            logger.info("Fetch run {} started: {} tiles from '{}' with {} workers",
                runName, target, pager.getTopic(), workerCount);
            try (FetchWorkerPool workers = pool) {
                workers.start();
                while (state != FetchState.DONE) {
                    handle(mailbox.take());
                    if (state == FetchState.DRAINING && inFlight == 0) {
                        state = FetchState.FAILED;
                        logger.warn("Fetch run {} exhausted '{}': {} of {} tiles, {} failed of {} submitted",
                            runName, pager.getTopic(), tiles.size(), target, failed, submitted);
                        throw new InsufficientTilesException(target, tiles.size(), failed, submitted);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state = FetchState.FAILED;
                throw new TileFetchException("Interrupted while collecting tiles for '" + pager.getTopic() + "'", e);
            } catch (SourceUnavailableException e) {
                state = FetchState.FAILED;
                logger.warn("Fetch run {} aborted after {} page(s): {}", runName, pager.getPagesRequested(), e.getMessage());
                throw e;
            }

            FetchRunSummary summary = new FetchRunSummary(tiles, pager.getPagesRequested(), submitted, failed, inFlight);
            logger.info("Fetch run {} done: {} tiles from {} page(s), {} submitted, {} failed, {} abandoned",
                runName, summary.tiles().size(), summary.pagesRequested(), summary.submitted(),
                summary.failed(), summary.abandoned());
            return summary;
        }

        private void handle(FetchEvent event) {
            switch (event.kind()) {
                case WORKER_READY -> {
                    idleWorkers++;
                    dispatch();
                }
                case SUCCEEDED -> {
                    inFlight--;
                    tiles.add(event.tile());
                    ExternalApiLogger.logFetchProgress(logger, tiles.size(), target);
                    if (tiles.size() >= target) {
                        state = FetchState.DONE;
                    }
                }
                case FAILED -> {
                    inFlight--;
                    failed++;
                    logger.warn("Fetch job #{} failed for {}: {}",
                        event.job().sequence(), event.job().url(), event.error().getMessage());
                    logger.debug("Fetch job #{} failure detail", event.job().sequence(), event.error());
                    dispatch();
                }
            }
        }

        private void dispatch() {
            while (idleWorkers > 0 && state != FetchState.DONE) {
                if (!pendingCandidates.isEmpty()) {
                    state = FetchState.DISPATCHING;
                    pool.submit(new FetchJob(submitted, pendingCandidates.poll()));
                    idleWorkers--;
                    inFlight++;
                    submitted++;
                } else if (pager.isExhausted()) {
                    state = FetchState.DRAINING;
                    return;
                } else if (tiles.size() + inFlight >= target) {
                    // Outstanding jobs can still reach the target; wait for their results first
                    return;
                } else {
                    state = FetchState.PAGING;
                    ListingPage page = pager.nextPage();
                    pendingCandidates.addAll(page.items());
                    logger.debug("Fetch run {} page {} queued {} candidate(s)",
                        runName, pager.getPagesRequested(), page.items().size());
                }
            }
        }
    }
}
