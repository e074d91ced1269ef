package com.vendoretl;

import com.vendoretl.error.PipelineException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Bounds how many operations run at once and how many may start within a trailing time window.
 *
 * <p>{@link #acquire(String)} never blocks the caller: it returns a future that completes with a
 * {@link Permit} once both limits allow it. Waiters are served in FIFO order. A waiter is woken
 * either by a permit being closed or, when only the window is full, by a timer scheduled for the
 * moment the oldest grant leaves the window.
 */
@Slf4j
public class RateLimiter {

    private final String name;
    private final int maxConcurrent;
    private final int maxRequestsPerWindow;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final ScheduledExecutorService scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final Deque<Long> grantTimes = new ArrayDeque<>();
    private int inFlight;
    private int peakInFlight;
    private boolean recheckScheduled;
    private Throwable closedWith;

    public RateLimiter(String name, int maxConcurrent, int maxRequestsPerWindow, Duration window,
                       ScheduledExecutorService scheduler) {
        this(name, maxConcurrent, maxRequestsPerWindow, window, scheduler, System::nanoTime);
    }

    RateLimiter(String name, int maxConcurrent, int maxRequestsPerWindow, Duration window,
                ScheduledExecutorService scheduler, LongSupplier nanoClock) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.maxRequestsPerWindow = maxRequestsPerWindow;
        this.windowNanos = window.toNanos();
        this.scheduler = scheduler;
        this.nanoClock = nanoClock;
    }

    /** A limiter with only a concurrency ceiling. */
    public static RateLimiter concurrencyOnly(String name, int maxConcurrent, ScheduledExecutorService scheduler) {
        return new RateLimiter(name, maxConcurrent, 0, Duration.ZERO, scheduler);
    }

    public CompletableFuture<Permit> acquire(String cityId) {
        Waiter waiter = new Waiter(cityId);
        List<Waiter> ready;
        lock.lock();
        try {
            if (closedWith != null) {
                return CompletableFuture.failedFuture(closedWith);
            }
            waiters.addLast(waiter);
            ready = drain();
        } finally {
            lock.unlock();
        }
        hand(ready);
        return waiter.future;
    }

    /**
     * Runs {@code operation} under a permit that is released when the operation's future completes,
     * or straight away if starting it throws.
     */
    public <T> CompletableFuture<T> withPermit(String cityId, Supplier<CompletableFuture<T>> operation) {
        return acquire(cityId).thenCompose(permit -> {
            CompletableFuture<T> running;
            try {
                running = operation.get();
            } catch (RuntimeException e) {
                permit.close();
                return CompletableFuture.failedFuture(e);
            }
            return running.whenComplete((value, error) -> permit.close());
        });
    }

    /**
     * Fails every queued and future acquire. Permits already handed out stay valid until closed.
     */
    public void close(Throwable reason) {
        List<Waiter> pending;
        lock.lock();
        try {
            if (closedWith != null) {
                return;
            }
            closedWith = reason;
            pending = new ArrayList<>(waiters);
            waiters.clear();
        } finally {
            lock.unlock();
        }
        if (!pending.isEmpty()) {
            log.info("{} limiter closed, failing {} waiting request(s)", name, pending.size());
        }
        pending.forEach(w -> w.future.completeExceptionally(reason));
    }

    /** Closes the limiter when the run is cancelled. */
    public RateLimiter bindTo(CancellationToken cancellation) {
        cancellation.onCancel(() -> close(PipelineException.cancelled("Run cancelled while waiting for a " + name + " permit")));
        return this;
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int peakInFlight() {
        lock.lock();
        try {
            return peakInFlight;
        } finally {
            lock.unlock();
        }
    }

    private void release(Permit permit) {
        List<Waiter> ready;
        lock.lock();
        try {
            inFlight--;
            ready = drain();
        } finally {
            lock.unlock();
        }
        log.trace("{} permit released by city={}", name, permit.cityId);
        hand(ready);
    }

    // caller holds lock
    private List<Waiter> drain() {
        List<Waiter> ready = new ArrayList<>();
        long now = nanoClock.getAsLong();
        boolean windowed = maxRequestsPerWindow > 0 && windowNanos > 0;
        if (windowed) {
            while (!grantTimes.isEmpty() && now - grantTimes.peekFirst() >= windowNanos) {
                grantTimes.pollFirst();
            }
        }
        while (!waiters.isEmpty() && inFlight < maxConcurrent) {
            if (windowed && grantTimes.size() >= maxRequestsPerWindow) {
                scheduleRecheck(grantTimes.peekFirst() + windowNanos - now);
                break;
            }
            Waiter waiter = waiters.pollFirst();
            if (waiter.future.isDone()) {
                // abandoned by its caller
                continue;
            }
            inFlight++;
            peakInFlight = Math.max(peakInFlight, inFlight);
            if (windowed) {
                grantTimes.addLast(now);
            }
            ready.add(waiter);
        }
        return ready;
    }

    // caller holds lock
    private void scheduleRecheck(long delayNanos) {
        if (recheckScheduled) {
            return;
        }
        recheckScheduled = true;
        log.debug("{} rate window full, next slot in {} ms", name, TimeUnit.NANOSECONDS.toMillis(delayNanos));
        scheduler.schedule(() -> {
            List<Waiter> ready;
            lock.lock();
            try {
                recheckScheduled = false;
                ready = drain();
            } finally {
                lock.unlock();
            }
            hand(ready);
        }, Math.max(delayNanos, 0L), TimeUnit.NANOSECONDS);
    }

    // completes futures outside the lock so their callbacks never run while holding it
    private void hand(List<Waiter> ready) {
        for (Waiter waiter : ready) {
            Permit permit = new Permit(waiter.cityId);
            if (!waiter.future.complete(permit)) {
                permit.close();
            }
        }
    }

    private static final class Waiter {
        final String cityId;
        final CompletableFuture<Permit> future = new CompletableFuture<>();

        Waiter(String cityId) {
            this.cityId = cityId;
        }
    }

    /**
     * The right to run one operation. Closing it more than once is harmless.
     */
    public final class Permit implements AutoCloseable {
        private final String cityId;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(String cityId) {
            this.cityId = cityId;
        }

        public String getCityId() {
            return cityId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(this);
            }
        }
    }
}
