package io.chatrelay.server.core;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 *
 * <p>A failed task does not stop the chain. If the backing executor rejects a task its future
 * completes exceptionally with the rejection.
 */
final class SerialExecutor {
    private final Executor executor;
    private final Object lock = new Object();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    SerialExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> out = new CompletableFuture<>();
        synchronized (lock) {
            CompletableFuture<Void> next = tail
                    .handle((ok, err) -> null)
                    .thenRunAsync(() -> {
                        try {
                            out.complete(task.call());
                        } catch (Throwable t) {
                            out.completeExceptionally(t);
                        }
                    }, executor);
            next.whenComplete((ok, err) -> {
                if (err != null) {
                    out.completeExceptionally(err);
                }
            });
            tail = next;
        }
        return out;
    }
}
