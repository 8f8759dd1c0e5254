package com.github.dimitryivaniuta.guard.proxy.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Futures {
    private Futures() {}

    /**
     * Strips the wrappers CompletableFuture adds around a failure so callers can match on
     * the real exception type.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    /**
     * A new future that mirrors {@code source} (unwrapped failure included). Completing or
     * cancelling the returned future has no effect on {@code source}.
     */
    public static <T> CompletableFuture<T> detached(CompletableFuture<T> source) {
        CompletableFuture<T> view = new CompletableFuture<>();
        source.whenComplete((value, error) -> settle(view, value, error));
        return view;
    }

    public static <T> void settle(CompletableFuture<T> target, T value, Throwable error) {
        if (error != null) {
            target.completeExceptionally(unwrap(error));
        } else {
            target.complete(value);
        }
    }
}
