package com.capturequeue.engine;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-pass execution context shared by both phases.
 *
 * <p>A new context is created for every {@link QueueOrchestrator#run()} pass. It provides:</p>
 * <ul>
 *   <li>Cooperative cancellation via an atomic flag</li>
 *   <li>A cancellable timed wait used for retry backoff</li>
 *   <li>The set of items deferred to the next pass after a storage failure</li>
 *   <li>Counters summarising what the pass did</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Fetch workers read the
 * cancellation flag and update counters concurrently while another thread may
 * call {@link #cancel()}.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * for (Item item : items) {
 *     run.throwIfCancelled();
 *     process(item);
 * }
 * }</pre>
 *
 * @author Capture Queue Team
 * @see QueueOrchestrator#stop()
 */
public class RunContext {
    private final String passId;
    private final AtomicBoolean cancelled;
    // Released once on cancel; every pending sleep wakes up
    private final CountDownLatch cancelSignal;
    private final Set<String> deferred;

    private final AtomicInteger captured = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger retried = new AtomicInteger();

    public RunContext() {
        this.passId = UUID.randomUUID().toString().substring(0, 8);
        this.cancelled = new AtomicBoolean(false);
        this.cancelSignal = new CountDownLatch(1);
        this.deferred = ConcurrentHashMap.newKeySet();
    }

    /**
     * @return short identifier used in log lines for this pass
     */
    public String getPassId() {
        return passId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request cancellation. Idempotent; wakes every thread blocked in {@link #sleep(long)}.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelSignal.countDown();
        }
    }

    /**
     * Throw InterruptedException if the pass has been cancelled.
     *
     * @throws InterruptedException if the pass has been cancelled
     */
    public void throwIfCancelled() throws InterruptedException {
        if (cancelled.get()) {
            throw new InterruptedException("Pass " + passId + " was cancelled");
        }
    }

    /**
     * Wait for the given time unless the pass is cancelled first.
     *
     * @param millis how long to wait; values &lt;= 0 only check for cancellation
     * @throws InterruptedException if the pass is cancelled before or during the wait,
     *         or the calling thread is interrupted
     */
    public void sleep(long millis) throws InterruptedException {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        if (cancelSignal.await(millis, TimeUnit.MILLISECONDS)) {
            throw new InterruptedException("Pass " + passId + " was cancelled during backoff");
        }
    }

    /**
     * Exclude an item from the rest of this pass.
     */
    public void defer(String itemId) {
        deferred.add(itemId);
    }

    public boolean isDeferred(String itemId) {
        return deferred.contains(itemId);
    }

    public Set<String> getDeferred() {
        return Collections.unmodifiableSet(deferred);
    }

    void recordCaptured() { captured.incrementAndGet(); }
    void recordCompleted() { completed.incrementAndGet(); }
    void recordFailed() { failed.incrementAndGet(); }
    void recordRetried() { retried.incrementAndGet(); }

    public int getCaptured() { return captured.get(); }
    public int getCompleted() { return completed.get(); }
    public int getFailed() { return failed.get(); }
    public int getRetried() { return retried.get(); }

    /**
     * @return counters of this pass, for logging and the status endpoint
     */
    public Map<String, Object> summary() {
        return Map.of(
                "passId", passId,
                "captured", captured.get(),
                "completed", completed.get(),
                "failed", failed.get(),
                "retried", retried.get(),
                "deferred", deferred.size(),
                "cancelled", cancelled.get());
    }

    @Override
    public String toString() {
        return "RunContext{passId='" + passId + "', cancelled=" + cancelled.get() + '}';
    }
}
