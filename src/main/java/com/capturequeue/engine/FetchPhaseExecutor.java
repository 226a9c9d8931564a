package com.capturequeue.engine;

import com.capturequeue.core.FetchFailure;
import com.capturequeue.core.FetchedContent;
import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.RetryContext;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.ContentFetcher;
import com.capturequeue.spi.ItemStorage;
import com.capturequeue.spi.JobTracker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Downloads raw content for items awaiting capture on a bounded worker pool.
 *
 * <p><b>Execution Model:</b></p>
 * <ol>
 *   <li>Load every {@link ItemStatus#AWAITING_CAPTURE} item not deferred in this pass</li>
 *   <li>Submit one task per item to a fixed pool of {@code fetchConcurrency} threads</li>
 *   <li>Wait for every task to settle; one item's failure never stops the others</li>
 *   <li>Repeat while items remain, so an item put back by a retry is fetched again in the same pass</li>
 * </ol>
 *
 * <p>The loop terminates because every failure either raises the item's retry
 * count towards its budget or defers the item to the next pass.</p>
 *
 * <p><b>Thread Safety:</b> {@link #execute(RunContext)} is called by one thread
 * at a time (the orchestrator's guard); the per-item tasks run concurrently
 * and never touch the same item.</p>
 *
 * @author Capture Queue Team
 * @see RetryCoordinator
 */
public class FetchPhaseExecutor {
    private static final Logger logger = Logger.getLogger(FetchPhaseExecutor.class.getName());

    private final ItemStorage storage;
    private final JobTracker jobTracker;
    private final ContentFetcher fetcher;
    private final RetryCoordinator retryCoordinator;
    private final Duration timeout;
    private final int concurrency;
    private final ExecutorService pool;

    public FetchPhaseExecutor(ItemStorage storage, JobTracker jobTracker, ContentFetcher fetcher,
                              RetryCoordinator retryCoordinator, int concurrency, Duration timeout) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1: " + concurrency);
        }
        this.storage = storage;
        this.jobTracker = jobTracker;
        this.fetcher = fetcher;
        this.retryCoordinator = retryCoordinator;
        this.concurrency = concurrency;
        this.timeout = timeout;
        this.pool = Executors.newFixedThreadPool(concurrency);
    }

    /**
     * Run fetch rounds until no eligible item is left.
     *
     * @param run the current pass
     * @return number of items captured
     * @throws StorageFailure if the awaiting items could not be loaded
     * @throws InterruptedException if the pass was cancelled
     */
    public int execute(RunContext run) throws StorageFailure, InterruptedException {
        int capturedBefore = run.getCaptured();
        int round = 0;

        while (true) {
            run.throwIfCancelled();

            List<Item> batch = new ArrayList<>();
            for (Item item : storage.getItemsByStatus(ItemStatus.AWAITING_CAPTURE)) {
                if (!run.isDeferred(item.getId())) {
                    batch.add(item);
                }
            }
            if (batch.isEmpty()) {
                break;
            }

            round++;
            logger.info("Fetch round " + round + " of pass " + run.getPassId() + ": "
                    + batch.size() + " items, concurrency " + concurrency);

            List<Future<?>> futures = new ArrayList<>(batch.size());
            for (Item item : batch) {
                futures.add(pool.submit(() -> fetchOne(item, run)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    logger.log(Level.SEVERE, "Fetch task failed unexpectedly", e.getCause());
                }
            }
        }

        return run.getCaptured() - capturedBefore;
    }

    /**
     * Fetch one item and record the outcome. Never throws.
     */
    void fetchOne(Item item, RunContext run) {
        if (run.isCancelled()) {
            return;
        }
        String itemId = item.getId();

        FetchedContent fetched;
        try {
            fetched = fetch(fetcher, item.getUrl(), timeout);
        } catch (FetchFailure failure) {
            logger.warning("Fetch failed for " + item.getUrl() + ": " + failure.getMessage());
            handleFailure(item, failure, run);
            return;
        }

        try {
            storage.updateItem(itemId, ItemUpdate.create()
                    .status(ItemStatus.CAPTURED)
                    .content(fetched.getContent())
                    .title(chooseTitle(fetched.getTitle(), item))
                    .retryCount(0)
                    .clearErrorMessage());
            jobTracker.updateJobItemByItemId(itemId, JobItemUpdate.create()
                    .status(JobItemStatus.COMPLETE)
                    .retryCount(0)
                    .clearErrorMessage());
            run.recordCaptured();
            logger.fine("Captured " + item.getUrl());
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Failed to store fetched content for item " + itemId
                    + ", deferring to next pass", e);
            run.defer(itemId);
        }
    }

    private void handleFailure(Item item, FetchFailure failure, RunContext run) {
        try {
            retryCoordinator.handleErrorWithRetry(
                    RetryContext.forItem(item, retryCoordinator.getMaxRetries()),
                    failure, ItemStatus.AWAITING_CAPTURE, run);
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Failed to record fetch failure for item " + item.getId()
                    + ", deferring to next pass", e);
            run.defer(item.getId());
        } catch (InterruptedException e) {
            logger.info("Backoff for item " + item.getId() + " interrupted: " + e.getMessage());
            if (!run.isCancelled()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Call the fetcher, turning runtime errors and empty responses into {@link FetchFailure}.
     */
    static FetchedContent fetch(ContentFetcher fetcher, String url, Duration timeout) throws FetchFailure {
        FetchedContent fetched;
        try {
            fetched = fetcher.fetchContent(url, timeout);
        } catch (RuntimeException e) {
            throw new FetchFailure(url, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        if (fetched == null || fetched.getContent() == null) {
            throw new FetchFailure(url, "Empty response");
        }
        return fetched;
    }

    static String chooseTitle(String fetchedTitle, Item item) {
        if (fetchedTitle != null && !fetchedTitle.isBlank()) {
            return fetchedTitle.trim();
        }
        if (item.getTitle() != null && !item.getTitle().isBlank()) {
            return item.getTitle();
        }
        return item.getUrl();
    }

    public int getConcurrency() {
        return concurrency;
    }

    ExecutorService getPool() {
        return pool;
    }
}
