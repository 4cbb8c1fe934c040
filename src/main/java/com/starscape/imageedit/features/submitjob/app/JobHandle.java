package com.starscape.imageedit.features.submitjob.app;

import java.util.concurrent.CompletableFuture;

/**
 * Returned as soon as a job is accepted. The future covers only the dispatch
 * phase; it fails when nothing could be dispatched because of an error.
 */
public record JobHandle(String jobId, CompletableFuture<DispatchReport> dispatch) {
}
