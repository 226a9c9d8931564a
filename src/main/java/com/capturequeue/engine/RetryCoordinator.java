package com.capturequeue.engine;

import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.PipelineEvent;
import com.capturequeue.core.RetryContext;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.EventSink;
import com.capturequeue.spi.ItemStorage;
import com.capturequeue.spi.JobTracker;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single decision point for failed item attempts.
 *
 * <p>This is the only component that increments an item's retry count or moves
 * it to {@link ItemStatus#ERROR}. Per item the state machine is:</p>
 * <pre>
 * Active(k) --failure, k &lt; max--&gt; retry: sleep(backoff(k)); Active(k+1)
 * Active(k) --failure, k &gt;= max--&gt; Error (terminal)
 * </pre>
 *
 * <p>Resetting the counter on success belongs to the phase executors, not here.</p>
 *
 * <p><b>Thread Safety:</b> Stateless apart from its collaborators; called
 * concurrently from fetch workers.</p>
 *
 * @author Capture Queue Team
 * @see BackoffCalculator
 */
public class RetryCoordinator {
    private static final Logger logger = Logger.getLogger(RetryCoordinator.class.getName());

    private final ItemStorage storage;
    private final JobTracker jobTracker;
    private final EventSink events;
    private final BackoffCalculator backoff;
    private final int maxRetries;

    public RetryCoordinator(ItemStorage storage, JobTracker jobTracker, EventSink events,
                            BackoffCalculator backoff, int maxRetries) {
        this.storage = storage;
        this.jobTracker = jobTracker;
        this.events = GuardedEventSink.wrap(events);
        this.backoff = backoff;
        this.maxRetries = maxRetries;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Retry the item or fail it for good, depending on its retry budget.
     *
     * @param ctx the failed attempt
     * @param failure what went wrong
     * @param nextStatus status the item re-enters on retry
     * @param run the current pass, whose cancellation interrupts the backoff wait
     * @return true if the failure was terminal
     * @throws StorageFailure if the item or job item could not be updated
     * @throws InterruptedException if the pass was cancelled during the backoff wait
     */
    public boolean handleErrorWithRetry(RetryContext ctx, Exception failure, ItemStatus nextStatus, RunContext run)
            throws StorageFailure, InterruptedException {
        if (ctx.hasRetriesLeft()) {
            handleRetry(ctx, failure, nextStatus, run);
            return false;
        }
        handleFinalFailure(ctx, failure, run);
        return true;
    }

    /**
     * Record attempt {@code k+1}, then wait {@code backoff(k)} before returning.
     *
     * @throws StorageFailure if the item could not be updated; nothing was recorded
     */
    public void handleRetry(RetryContext ctx, Exception failure, ItemStatus nextStatus, RunContext run)
            throws StorageFailure, InterruptedException {
        String itemId = ctx.getItem().getId();
        int attempt = ctx.getCurrentRetryCount();
        int nextCount = attempt + 1;
        String message = "Retry " + nextCount + "/" + ctx.getMaxRetries() + ": " + causeOf(failure);

        storage.updateItem(itemId, ItemUpdate.create()
                .status(nextStatus)
                .retryCount(nextCount)
                .errorMessage(message));
        run.recordRetried();

        // The item's count is authoritative; COMPLETE and ERROR rewrite the job item's count from it.
        try {
            jobTracker.updateJobItemByItemId(itemId, JobItemUpdate.create()
                    .status(JobItemStatus.PENDING)
                    .retryCount(nextCount)
                    .errorMessage(message));
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Retry " + nextCount + " of item " + itemId
                    + " recorded but its job item update failed", e);
        }

        long delay = backoff.delayFor(attempt);
        logger.info("Item " + itemId + " will retry in " + delay + " ms (attempt "
                + nextCount + "/" + ctx.getMaxRetries() + ")");
        run.sleep(delay);
    }

    /**
     * Mark the item and its job item as failed and announce it.
     */
    public void handleFinalFailure(RetryContext ctx, Exception failure, RunContext run) throws StorageFailure {
        String itemId = ctx.getItem().getId();
        String message = "Failed after " + (ctx.getMaxRetries() + 1) + " attempts: " + causeOf(failure);

        storage.updateItem(itemId, ItemUpdate.create()
                .status(ItemStatus.ERROR)
                .errorMessage(message));

        JobItem jobItem = jobTracker.getJobItemByItemId(itemId);
        if (jobItem != null) {
            jobTracker.updateJobItemByItemId(itemId, JobItemUpdate.create()
                    .status(JobItemStatus.ERROR)
                    .retryCount(ctx.getCurrentRetryCount())
                    .errorMessage(message));
            jobTracker.recomputeJobStatus(jobItem.getJobId());
        }
        run.recordFailed();

        logger.warning("Item " + itemId + " exhausted retries: " + message);
        events.publish(PipelineEvent.processingFailed(itemId, message));
    }

    /**
     * @return the failure's message, or its class name when it has none
     */
    static String causeOf(Throwable failure) {
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getSimpleName();
    }
}
