package com.vendoretl;

import com.vendoretl.error.PipelineException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Run-wide cancellation signal. In-flight futures registered here are cancelled when the run is,
 * so nothing waits on a network call that will never be used.
 */
@Slf4j
public class CancellationToken {

    private volatile boolean cancelled;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw PipelineException.cancelled("Run cancelled");
        }
    }

    /**
     * Tracks {@code future} until it completes. If the run is already cancelled the future is
     * cancelled straight away.
     */
    public <T> CompletableFuture<T> register(CompletableFuture<T> future) {
        inFlight.add(future);
        future.whenComplete((result, error) -> inFlight.remove(future));
        if (cancelled) {
            future.cancel(true);
        }
        return future;
    }

    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled) {
            listener.run();
        }
    }

    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        log.warn("Cancelling run: {} operation(s) in flight", inFlight.size());
        for (CompletableFuture<?> future : inFlight) {
            future.cancel(true);
        }
        listeners.forEach(Runnable::run);
    }
}
