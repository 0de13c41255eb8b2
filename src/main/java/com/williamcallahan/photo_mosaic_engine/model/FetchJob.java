package com.williamcallahan.photo_mosaic_engine.model;

/**
 * One candidate URL handed to the worker pool. The sequence index records assignment order
 * for logging only.
 */
public record FetchJob(int sequence, String url) {
}
