package com.capturequeue.engine;

import com.capturequeue.core.FetchFailure;
import com.capturequeue.core.FetchedContent;
import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.MarkdownRecord;
import com.capturequeue.core.PipelineEvent;
import com.capturequeue.core.PipelineException;
import com.capturequeue.core.ProcessingFailure;
import com.capturequeue.core.QaRecord;
import com.capturequeue.core.QuestionAnswer;
import com.capturequeue.core.RetryContext;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.ContentFetcher;
import com.capturequeue.spi.EmbeddingProvider;
import com.capturequeue.spi.EventSink;
import com.capturequeue.spi.ItemStorage;
import com.capturequeue.spi.JobTracker;
import com.capturequeue.spi.MarkdownExtractor;
import com.capturequeue.spi.QaGenerator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns captured content into markdown, Q&amp;A pairs and embeddings, one item at a time.
 *
 * <p><b>Per-item pipeline:</b></p>
 * <ol>
 *   <li>Mark the item PROCESSING, its job item IN_PROGRESS, publish PROCESSING_STARTED</li>
 *   <li>Fetch content inline if the item has none</li>
 *   <li>Markdown: reuse the stored record, else extract and save</li>
 *   <li>Q&amp;A: skip if pairs are stored, else generate; zero pairs ends the item successfully</li>
 *   <li>Embeddings: embed questions, answers and combined texts as three concurrent batches,
 *       then save one record per pair</li>
 *   <li>Mark the item COMPLETE, recompute its job, publish ITEM_READY</li>
 * </ol>
 *
 * <p>Each stage checks what is already stored before doing work, so an item
 * interrupted by a crash or a retry resumes where it stopped. A failing stage
 * aborts the rest and hands the item to the {@link RetryCoordinator} with
 * next status {@link ItemStatus#AWAITING_PROCESSING}.</p>
 *
 * <p><b>Thread Safety:</b> Items are processed strictly sequentially on the
 * calling thread. Only the embedding fan-out uses extra threads.</p>
 *
 * @author Capture Queue Team
 */
public class ContentProcessingExecutor {
    private static final Logger logger = Logger.getLogger(ContentProcessingExecutor.class.getName());

    static final int BATCH_SIZE = 10;

    private static final Comparator<Item> OLDEST_FIRST = Comparator
            .comparing(Item::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(Item::getId);

    private final ItemStorage storage;
    private final JobTracker jobTracker;
    private final ContentFetcher fetcher;
    private final Duration fetchTimeout;
    private final MarkdownExtractor markdownExtractor;
    private final QaGenerator qaGenerator;
    private final EmbeddingProvider embeddingProvider;
    private final EventSink events;
    private final RetryCoordinator retryCoordinator;
    private final ExecutorService embeddingPool;

    public ContentProcessingExecutor(ItemStorage storage, JobTracker jobTracker,
                                     ContentFetcher fetcher, Duration fetchTimeout,
                                     MarkdownExtractor markdownExtractor, QaGenerator qaGenerator,
                                     EmbeddingProvider embeddingProvider, EventSink events,
                                     RetryCoordinator retryCoordinator) {
        this.storage = storage;
        this.jobTracker = jobTracker;
        this.fetcher = fetcher;
        this.fetchTimeout = fetchTimeout;
        this.markdownExtractor = markdownExtractor;
        this.qaGenerator = qaGenerator;
        this.embeddingProvider = embeddingProvider;
        this.events = GuardedEventSink.wrap(events);
        this.retryCoordinator = retryCoordinator;
        this.embeddingPool = Executors.newCachedThreadPool();
    }

    /**
     * Process ready items, oldest first, until none is left.
     *
     * <p>Ready items are loaded in batches of {@value #BATCH_SIZE}. A batch is
     * abandoned as soon as one of its items is sent back for a retry, so the
     * retried item is picked up again in creation order.</p>
     *
     * @param run the current pass
     * @return number of items completed
     * @throws StorageFailure if the ready items could not be loaded
     * @throws InterruptedException if the pass was cancelled
     */
    public int execute(RunContext run) throws StorageFailure, InterruptedException {
        int completedBefore = run.getCompleted();
        List<Item> batch;
        while (!(batch = nextBatch(run)).isEmpty()) {
            for (Item item : batch) {
                run.throwIfCancelled();
                int retriedBefore = run.getRetried();
                processItem(item, run);
                if (run.getRetried() != retriedBefore) {
                    break;
                }
            }
        }
        return run.getCompleted() - completedBefore;
    }

    /**
     * The oldest ready items not deferred in this pass, at most {@value #BATCH_SIZE}.
     */
    List<Item> nextBatch(RunContext run) throws StorageFailure {
        int limit = BATCH_SIZE + run.getDeferred().size();
        List<Item> ready = new ArrayList<>(storage.getItemsByStatus(ItemStatus.CAPTURED, limit));
        ready.addAll(storage.getItemsByStatus(ItemStatus.AWAITING_PROCESSING, limit));
        return ready.stream()
                .filter(item -> !run.isDeferred(item.getId()))
                .sorted(OLDEST_FIRST)
                .limit(BATCH_SIZE)
                .collect(Collectors.toList());
    }

    /**
     * Run the full pipeline for one item.
     *
     * @throws InterruptedException if the pass was cancelled; the item is left resumable
     */
    void processItem(Item item, RunContext run) throws InterruptedException {
        String itemId = item.getId();
        boolean marked = false;
        try {
            storage.updateItem(itemId, ItemUpdate.create().status(ItemStatus.PROCESSING));
            marked = true;
            jobTracker.updateJobItemByItemId(itemId, JobItemUpdate.create().status(JobItemStatus.IN_PROGRESS));
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Failed to start processing item " + itemId + ", deferring to next pass", e);
            if (marked) {
                resetForResume(item);
            }
            run.defer(itemId);
            return;
        }
        events.publish(PipelineEvent.processingStarted(itemId));
        logger.info("Processing item " + itemId + " (" + item.getDisplayName() + ")");

        try {
            runStages(item, run);
        } catch (FetchFailure failure) {
            handleFailure(item, failure, ItemStatus.AWAITING_CAPTURE, run);
            return;
        } catch (ProcessingFailure | StorageFailure failure) {
            handleFailure(item, failure, ItemStatus.AWAITING_PROCESSING, run);
            return;
        } catch (InterruptedException e) {
            logger.info("Processing of item " + itemId + " cancelled, resetting for resume");
            resetForResume(item);
            throw e;
        }

        boolean itemComplete = false;
        try {
            storage.updateItem(itemId, ItemUpdate.create()
                    .status(ItemStatus.COMPLETE)
                    .retryCount(0)
                    .clearErrorMessage());
            itemComplete = true;
            jobTracker.updateJobItemByItemId(itemId, JobItemUpdate.create()
                    .status(JobItemStatus.COMPLETE)
                    .retryCount(0)
                    .clearErrorMessage());
            JobItem jobItem = jobTracker.getJobItemByItemId(itemId);
            if (jobItem != null) {
                jobTracker.recomputeJobStatus(jobItem.getJobId());
            }
        } catch (StorageFailure e) {
            if (itemComplete) {
                logger.log(Level.SEVERE, "Item " + itemId + " complete but its job bookkeeping failed", e);
            } else {
                logger.log(Level.SEVERE, "Failed to mark item " + itemId + " complete, deferring to next pass", e);
                resetForResume(item);
            }
            run.defer(itemId);
            return;
        }

        run.recordCompleted();
        logger.info("Item " + itemId + " complete");
        events.publish(PipelineEvent.itemReady(itemId));
    }

    private void runStages(Item item, RunContext run)
            throws FetchFailure, ProcessingFailure, StorageFailure, InterruptedException {
        if (!item.hasContent()) {
            captureInline(item);
        }
        run.throwIfCancelled();

        String markdown = ensureMarkdown(item);
        run.throwIfCancelled();

        if (!storage.getQaPairs(item.getId()).isEmpty()) {
            logger.fine("Q&A already stored for item " + item.getId() + ", skipping generation");
            return;
        }
        List<QuestionAnswer> pairs = generatePairs(markdown);
        if (pairs.isEmpty()) {
            logger.info("No Q&A pairs generated for item " + item.getId());
            return;
        }
        run.throwIfCancelled();

        List<QaRecord> records = embedPairs(item.getId(), pairs);
        storage.saveQaPairs(records);
        logger.fine("Stored " + records.size() + " Q&A pairs for item " + item.getId());
    }

    private void captureInline(Item item) throws FetchFailure, StorageFailure {
        logger.info("Item " + item.getId() + " has no content, fetching inline");
        FetchedContent fetched = FetchPhaseExecutor.fetch(fetcher, item.getUrl(), fetchTimeout);
        String title = FetchPhaseExecutor.chooseTitle(fetched.getTitle(), item);
        storage.updateItem(item.getId(), ItemUpdate.create()
                .content(fetched.getContent())
                .title(title));
        item.setContent(fetched.getContent());
        item.setTitle(title);
    }

    private String ensureMarkdown(Item item) throws ProcessingFailure, StorageFailure {
        MarkdownRecord existing = storage.getMarkdown(item.getId());
        if (existing != null && existing.getContent() != null) {
            logger.fine("Markdown already stored for item " + item.getId() + ", reusing");
            return existing.getContent();
        }

        String markdown;
        try {
            markdown = markdownExtractor.extract(item.getContent(), item.getUrl());
        } catch (RuntimeException e) {
            throw new ProcessingFailure(ProcessingFailure.Stage.MARKDOWN, RetryCoordinator.causeOf(e), e);
        }
        if (markdown == null || markdown.isBlank()) {
            throw new ProcessingFailure(ProcessingFailure.Stage.MARKDOWN, "Markdown extraction produced no content");
        }
        storage.saveMarkdown(MarkdownRecord.of(item.getId(), markdown));
        return markdown;
    }

    private List<QuestionAnswer> generatePairs(String markdown) throws ProcessingFailure {
        List<QuestionAnswer> pairs;
        try {
            pairs = qaGenerator.generatePairs(markdown);
        } catch (RuntimeException e) {
            throw new ProcessingFailure(ProcessingFailure.Stage.QA, RetryCoordinator.causeOf(e), e);
        }
        return pairs != null ? pairs : List.of();
    }

    /**
     * Embed the three text batches concurrently and zip them into records.
     */
    List<QaRecord> embedPairs(String itemId, List<QuestionAnswer> pairs)
            throws ProcessingFailure, InterruptedException {
        List<String> questions = new ArrayList<>(pairs.size());
        List<String> answers = new ArrayList<>(pairs.size());
        List<String> combined = new ArrayList<>(pairs.size());
        for (QuestionAnswer pair : pairs) {
            questions.add(pair.getQuestion());
            answers.add(pair.getAnswer());
            combined.add(pair.toCombinedText());
        }

        List<Callable<List<float[]>>> batches = List.of(
                () -> embeddingProvider.embed(questions),
                () -> embeddingProvider.embed(answers),
                () -> embeddingProvider.embed(combined));
        List<Future<List<float[]>>> futures = embeddingPool.invokeAll(batches);

        List<List<float[]>> vectors = new ArrayList<>(3);
        for (Future<List<float[]>> future : futures) {
            List<float[]> batch;
            try {
                batch = future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ProcessingFailure) {
                    throw (ProcessingFailure) cause;
                }
                throw new ProcessingFailure(ProcessingFailure.Stage.EMBED, RetryCoordinator.causeOf(cause), cause);
            }
            if (batch == null || batch.size() != pairs.size()) {
                throw new ProcessingFailure(ProcessingFailure.Stage.EMBED, "Expected " + pairs.size()
                        + " embeddings, got " + (batch == null ? 0 : batch.size()));
            }
            vectors.add(batch);
        }

        List<QaRecord> records = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            records.add(QaRecord.of(itemId, pairs.get(i),
                    vectors.get(0).get(i), vectors.get(1).get(i), vectors.get(2).get(i)));
        }
        return records;
    }

    private void handleFailure(Item item, PipelineException failure, ItemStatus nextStatus, RunContext run)
            throws InterruptedException {
        logger.warning("Processing failed for item " + item.getId() + ": " + failure.getMessage());
        try {
            retryCoordinator.handleErrorWithRetry(
                    RetryContext.forItem(item, retryCoordinator.getMaxRetries()), failure, nextStatus, run);
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Failed to record processing failure for item " + item.getId()
                    + ", deferring to next pass", e);
            resetForResume(item);
            run.defer(item.getId());
        }
    }

    /**
     * Best-effort return of an interrupted item to a state the next pass picks up.
     */
    private void resetForResume(Item item) {
        ItemStatus resumeStatus = item.hasContent() ? ItemStatus.AWAITING_PROCESSING : ItemStatus.AWAITING_CAPTURE;
        try {
            storage.updateItem(item.getId(), ItemUpdate.create().status(resumeStatus));
            jobTracker.updateJobItemByItemId(item.getId(), JobItemUpdate.create().status(JobItemStatus.PENDING));
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Failed to reset item " + item.getId()
                    + "; crash recovery will reset it on next start", e);
        }
    }

    ExecutorService getEmbeddingPool() {
        return embeddingPool;
    }
}
