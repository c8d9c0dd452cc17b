package com.market.anomaly.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Joins independent read-only sub-queries. The first failure fails the whole result and is
 * rethrown as the original exception, not wrapped.
 */
final class QueryFutures {

    private QueryFutures() {}

    static void awaitAll(CompletableFuture<?>... futures) {
        try {
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    /**
     * Value of a future already completed by {@link #awaitAll}.
     */
    static <T> T result(CompletableFuture<T> future) {
        return future.join();
    }
}
