package com.capturequeue.engine;

import com.capturequeue.config.PipelineConfig;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.core.SyncFailure;
import com.capturequeue.spi.ContentFetcher;
import com.capturequeue.spi.EmbeddingProvider;
import com.capturequeue.spi.EventSink;
import com.capturequeue.spi.ItemStorage;
import com.capturequeue.spi.JobTracker;
import com.capturequeue.spi.MarkdownExtractor;
import com.capturequeue.spi.QaGenerator;
import com.capturequeue.spi.SyncTrigger;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Top-level entry point of the background pipeline.
 *
 * <p>Each call to {@link #run()} performs one pass:</p>
 * <ol>
 *   <li>Crash recovery, once per orchestrator instance</li>
 *   <li>Fetch phase over AWAITING_CAPTURE items (parallel, bounded)</li>
 *   <li>Content processing over CAPTURED / AWAITING_PROCESSING items (sequential, oldest first)</li>
 *   <li>Sync trigger, once both phases are drained</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>{@code run()} may be called from any number of triggers (timer, enqueue, manual refresh);
 *       an atomic compare-and-set lets exactly one pass run at a time and the others return immediately</li>
 *   <li>The running flag is released in a {@code finally} block on every exit path</li>
 *   <li>{@link #stop()} cancels the current pass cooperatively through its {@link RunContext}</li>
 * </ul>
 *
 * <p><b>Error Handling:</b></p>
 * <ul>
 *   <li>Per-item failures are handled inside the phases and never end the pass</li>
 *   <li>StorageFailure while loading a phase's items: logged, the pass ends, the next pass retries</li>
 *   <li>SyncFailure: logged, never propagated</li>
 *   <li>Exceptions thrown by the event sink: logged, never propagated</li>
 *   <li>Unexpected runtime exceptions propagate to the caller after the flag is released</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * QueueOrchestrator orchestrator = QueueOrchestrator.builder()
 *         .config(config)
 *         .storage(itemRepository)
 *         .jobTracker(jobRepository)
 *         .fetcher(fetcher)
 *         .markdownExtractor(extractor)
 *         .qaGenerator(qa)
 *         .embeddingProvider(embeddings)
 *         .eventSink(broadcaster)
 *         .build();
 * orchestrator.start();
 * timer.scheduleWithFixedDelay(orchestrator::run, 0, 60, TimeUnit.SECONDS);
 * }</pre>
 *
 * @author Capture Queue Team
 * @see FetchPhaseExecutor
 * @see ContentProcessingExecutor
 * @see CrashRecoveryScanner
 */
public class QueueOrchestrator {
    private static final Logger logger = Logger.getLogger(QueueOrchestrator.class.getName());

    private final PipelineConfig config;
    private final CrashRecoveryScanner recoveryScanner;
    private final FetchPhaseExecutor fetchPhase;
    private final ContentProcessingExecutor processingPhase;
    private final SyncTrigger syncTrigger;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean recovered = new AtomicBoolean(false);
    private final Object recoveryLock = new Object();
    private final AtomicLong passCount = new AtomicLong();
    private volatile RunContext currentRun;
    private volatile RecoveryReport lastRecovery;
    private volatile Map<String, Object> lastPass;

    private QueueOrchestrator(Builder b) {
        this.config = b.config;
        this.syncTrigger = b.syncTrigger;

        EventSink events = GuardedEventSink.wrap(b.eventSink);
        RetryCoordinator retryCoordinator = new RetryCoordinator(b.storage, b.jobTracker, events,
                BackoffCalculator.fromConfig(b.config), b.config.getMaxRetries());
        Duration fetchTimeout = Duration.ofMillis(b.config.getFetchTimeoutMs());

        this.recoveryScanner = new CrashRecoveryScanner(b.storage, b.jobTracker);
        this.fetchPhase = new FetchPhaseExecutor(b.storage, b.jobTracker, b.fetcher, retryCoordinator,
                b.config.getFetchConcurrency(), fetchTimeout);
        this.processingPhase = new ContentProcessingExecutor(b.storage, b.jobTracker, b.fetcher, fetchTimeout,
                b.markdownExtractor, b.qaGenerator, b.embeddingProvider, events, retryCoordinator);

        logger.info("Queue orchestrator initialized: " + config);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Run crash recovery ahead of the first pass. Calling it again is a no-op
     * once recovery has succeeded.
     */
    public void start() {
        recoverIfNeeded();
    }

    /**
     * Perform one pass over the queue, or return immediately if a pass is
     * already in progress.
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            logger.info("Queue already processing, skipping");
            return;
        }

        RunContext run = new RunContext();
        currentRun = run;
        passCount.incrementAndGet();
        try {
            recoverIfNeeded();
            logger.info("Pass " + run.getPassId() + " started");

            int captured = fetchPhase.execute(run);
            logger.info("Pass " + run.getPassId() + ": fetch phase done, " + captured + " captured");

            int completed = processingPhase.execute(run);
            logger.info("Pass " + run.getPassId() + ": processing phase done, " + completed + " completed");

            triggerSync();
            logger.info("Pass " + run.getPassId() + " finished: " + run.summary());
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Pass " + run.getPassId() + " aborted by storage failure", e);
        } catch (InterruptedException e) {
            logger.info("Pass " + run.getPassId() + " cancelled: " + e.getMessage());
            if (!run.isCancelled()) {
                Thread.currentThread().interrupt();
            }
        } finally {
            lastPass = run.summary();
            currentRun = null;
            running.set(false);
        }
    }

    private void recoverIfNeeded() {
        if (recovered.get()) {
            return;
        }
        synchronized (recoveryLock) {
            if (recovered.get()) {
                return;
            }
            try {
                lastRecovery = recoveryScanner.recover();
                recovered.set(true);
            } catch (StorageFailure e) {
                logger.log(Level.SEVERE, "Crash recovery failed, will retry before the next pass", e);
            }
        }
    }

    private void triggerSync() {
        try {
            syncTrigger.triggerIfEnabled();
        } catch (SyncFailure e) {
            logger.log(Level.WARNING, "Sync failed", e);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Sync failed unexpectedly", e);
        }
    }

    /**
     * Cancel the pass in progress, if any. Items being worked on are left in
     * states the next pass resumes from.
     */
    public void stop() {
        RunContext run = currentRun;
        if (run != null) {
            logger.info("Cancelling pass " + run.getPassId());
            run.cancel();
        }
    }

    /**
     * Cancel the current pass and release the worker pools.
     */
    public void shutdown() {
        logger.info("Initiating graceful shutdown...");
        stop();
        shutdownPool(fetchPhase.getPool(), "fetch");
        shutdownPool(processingPhase.getEmbeddingPool(), "embedding");
        logger.info("Queue orchestrator shutdown complete");
    }

    private void shutdownPool(ExecutorService pool, String name) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warning("Forcing shutdown of " + name + " pool");
                pool.shutdownNow();
                if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.severe(name + " pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getPassCount() {
        return passCount.get();
    }

    /**
     * @return report of the last successful recovery, or null before recovery has run
     */
    public RecoveryReport getLastRecovery() {
        return lastRecovery;
    }

    /**
     * @return snapshot of orchestrator state for the status endpoint
     */
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("running", running.get());
        status.put("passCount", passCount.get());
        status.put("recovered", recovered.get());
        status.put("fetchConcurrency", fetchPhase.getConcurrency());
        status.put("maxRetries", config.getMaxRetries());
        RunContext run = currentRun;
        if (run != null) {
            status.put("currentPass", run.summary());
        }
        Map<String, Object> last = lastPass;
        if (last != null) {
            status.put("lastPass", last);
        }
        return status;
    }

    /**
     * Builder wiring the orchestrator to its collaborators.
     */
    public static final class Builder {
        private PipelineConfig config;
        private ItemStorage storage;
        private JobTracker jobTracker;
        private ContentFetcher fetcher;
        private MarkdownExtractor markdownExtractor;
        private QaGenerator qaGenerator;
        private EmbeddingProvider embeddingProvider;
        private EventSink eventSink = event -> { };
        private SyncTrigger syncTrigger = () -> { };

        private Builder() {
        }

        public Builder config(PipelineConfig config) { this.config = config; return this; }
        public Builder storage(ItemStorage storage) { this.storage = storage; return this; }
        public Builder jobTracker(JobTracker jobTracker) { this.jobTracker = jobTracker; return this; }
        public Builder fetcher(ContentFetcher fetcher) { this.fetcher = fetcher; return this; }
        public Builder markdownExtractor(MarkdownExtractor markdownExtractor) { this.markdownExtractor = markdownExtractor; return this; }
        public Builder qaGenerator(QaGenerator qaGenerator) { this.qaGenerator = qaGenerator; return this; }
        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) { this.embeddingProvider = embeddingProvider; return this; }
        public Builder eventSink(EventSink eventSink) { this.eventSink = eventSink; return this; }
        public Builder syncTrigger(SyncTrigger syncTrigger) { this.syncTrigger = syncTrigger; return this; }

        public QueueOrchestrator build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(storage, "storage");
            Objects.requireNonNull(jobTracker, "jobTracker");
            Objects.requireNonNull(fetcher, "fetcher");
            Objects.requireNonNull(markdownExtractor, "markdownExtractor");
            Objects.requireNonNull(qaGenerator, "qaGenerator");
            Objects.requireNonNull(embeddingProvider, "embeddingProvider");
            Objects.requireNonNull(eventSink, "eventSink");
            Objects.requireNonNull(syncTrigger, "syncTrigger");
            return new QueueOrchestrator(this);
        }
    }
}
