/**
 * Raised when the listing source is exhausted before the target tile count is reached
 *
 * @author William Callahan
 *
 * Features:
 * - Reports requested, collected, failed and submitted counts
 * - collected + failed always equals submitted once in-flight jobs have drained
 */

package com.williamcallahan.photo_mosaic_engine.exception;

public class InsufficientTilesException extends TileFetchException {

    private final int requested;
    private final int collected;
    private final int failed;
    private final int submitted;

    public InsufficientTilesException(int requested, int collected, int failed, int submitted) {
        super(String.format("Tile source exhausted after %d candidate(s): collected %d of %d requested tiles (%d failed)",
            submitted, collected, requested, failed));
        this.requested = requested;
        this.collected = collected;
        this.failed = failed;
        this.submitted = submitted;
    }

    public int getRequested() { return requested; }
    public int getCollected() { return collected; }
    public int getFailed() { return failed; }
    public int getSubmitted() { return submitted; }
}
