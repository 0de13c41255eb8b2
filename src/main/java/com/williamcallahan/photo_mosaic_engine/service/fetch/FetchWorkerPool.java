package com.williamcallahan.photo_mosaic_engine.service.fetch;

import com.williamcallahan.photo_mosaic_engine.exception.TileFetchException;
import com.williamcallahan.photo_mosaic_engine.model.FetchJob;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers sharing one job queue for the lifetime of a single fetch run
 *
 * @author William Callahan
 *
 * Features:
 * - Each worker announces itself on the mailbox before blocking on the job queue
 * - Posts exactly one result event per job taken
 * - Job failures, errors included, are reported, never thrown out of the worker loop
 * - Closing the queue lets workers finish queued jobs, then stop
 */
final class FetchWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FetchWorkerPool.class);

    // Identity-compared end-of-queue marker
    private static final FetchJob END_OF_QUEUE = new FetchJob(-1, null);

    private final int workerCount;
    private final TileFetcher tileFetcher;
    private final int tileSize;
    private final BlockingQueue<FetchEvent> mailbox;
    private final BlockingQueue<FetchJob> jobs = new LinkedBlockingQueue<>();
    private final CountDownLatch finished;
    private final ExecutorService executor;
    private final Duration shutdownGrace;

    private boolean started;
    private boolean queueClosed;

    FetchWorkerPool(String runName, int workerCount, TileFetcher tileFetcher, int tileSize,
                    BlockingQueue<FetchEvent> mailbox, Duration shutdownGrace) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        this.workerCount = workerCount;
        this.tileFetcher = tileFetcher;
        this.tileSize = tileSize;
        this.mailbox = mailbox;
        this.shutdownGrace = shutdownGrace;
        this.finished = new CountDownLatch(workerCount);
        this.executor = Executors.newFixedThreadPool(workerCount, namedThreads(runName));
    }

    void start() {
        if (started) {
            throw new IllegalStateException("Worker pool already started");
        }
        started = true;
        for (int i = 0; i < workerCount; i++) {
            executor.execute(this::runWorker);
        }
        logger.debug("Started {} fetch workers", workerCount);
    }

    void submit(FetchJob job) {
        if (queueClosed) {
            throw new IllegalStateException("Job queue is closed");
        }
        jobs.add(job);
    }

    /**
     * Queues one end marker per worker behind any pending jobs. Idempotent.
     */
    void closeQueue() {
        if (queueClosed) {
            return;
        }
        queueClosed = true;
        for (int i = 0; i < workerCount; i++) {
            jobs.add(END_OF_QUEUE);
        }
    }

    /**
     * Waits until every worker has left its loop.
     *
     * @return {@code true} if all workers finished within the timeout
     */
    boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        closeQueue();
        executor.shutdown();
        try {
            if (!started || awaitCompletion(shutdownGrace)) {
                return;
            }
            logger.warn("Fetch workers still busy after {} ms; interrupting", shutdownGrace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdownNow();
    }

    private void runWorker() {
        try {
            while (true) {
                mailbox.add(FetchEvent.workerReady());
                FetchJob job = jobs.take();
                if (job == END_OF_QUEUE) {
                    return;
                }
                mailbox.add(execute(job));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
        }
    }

    private FetchEvent execute(FetchJob job) {
        try {
            Tile tile = tileFetcher.fetch(job, tileSize);
            return FetchEvent.succeeded(job, tile);
        } catch (RuntimeException e) {
            return FetchEvent.failed(job, e);
        } catch (Error e) {
            // Every job taken must yield one result event; the worker stays in its loop
            logger.error("Fetch job #{} for {} raised {}", job.sequence(), job.url(), e.toString());
            return FetchEvent.failed(job, new TileFetchException(
                "Fetch job #" + job.sequence() + " aborted by " + e.getClass().getSimpleName(), e));
        }
    }

    private static ThreadFactory namedThreads(String runName) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tile-fetch-" + runName + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
