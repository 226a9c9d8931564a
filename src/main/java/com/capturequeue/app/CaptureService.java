package com.capturequeue.app;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.Job;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobMetadata;
import com.capturequeue.core.JobStatus;
import com.capturequeue.core.JobType;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.db.ItemRepository;
import com.capturequeue.db.JobRepository;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-facing API for putting pages into the queue and retrying failures.
 *
 * <p>Every operation that makes new work available triggers a pass
 * asynchronously; the orchestrator's own guard drops the trigger if a pass is
 * already running, and the running pass picks the new items up.</p>
 */
public class CaptureService {
    private static final Logger logger = Logger.getLogger(CaptureService.class.getName());

    private final ItemRepository itemRepository;
    private final JobRepository jobRepository;
    private final Executor triggerExecutor;
    private final Runnable passTrigger;

    /**
     * @param triggerExecutor executor the pass trigger is submitted to
     * @param passTrigger runs one pass, typically {@code orchestrator::run}
     */
    public CaptureService(ItemRepository itemRepository, JobRepository jobRepository,
                          Executor triggerExecutor, Runnable passTrigger) {
        this.itemRepository = itemRepository;
        this.jobRepository = jobRepository;
        this.triggerExecutor = triggerExecutor;
        this.passTrigger = passTrigger;
    }

    /**
     * Enqueue a single URL as a URL_FETCH job.
     *
     * @return the created job
     * @throws IllegalArgumentException if the URL is not http or https
     * @throws StorageFailure if the job could not be stored
     */
    public Job enqueueUrl(String url) throws StorageFailure {
        if (!isValidUrl(url)) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        Item item = newItem(url.trim());
        JobMetadata metadata = new JobMetadata();
        metadata.setUrl(item.getUrl());
        metadata.setItemId(item.getId());

        Job job = persist(JobType.URL_FETCH, metadata, List.of(item));
        triggerPass();
        return job;
    }

    /**
     * Enqueue a batch of URLs as one BULK_URL_IMPORT job. Invalid and duplicate
     * URLs are skipped and counted in the job metadata.
     *
     * @return the created job
     * @throws IllegalArgumentException if no URL in the batch is valid
     * @throws StorageFailure if the job could not be stored
     */
    public Job enqueueUrls(List<String> urls) throws StorageFailure {
        List<Item> items = toItems(urls);
        JobMetadata metadata = new JobMetadata();
        metadata.setTotalUrls(urls.size());
        metadata.setSkippedCount(urls.size() - items.size());
        metadata.setSuccessCount(0);
        metadata.setFailureCount(0);

        Job job = persist(JobType.BULK_URL_IMPORT, metadata, items);
        triggerPass();
        return job;
    }

    /**
     * Enqueue the URLs read from an import file as one FILE_IMPORT job.
     *
     * @param fileName name of the imported file, kept for display
     * @param urls URLs already parsed from the file
     * @return the created job
     */
    public Job enqueueImport(String fileName, List<String> urls) throws StorageFailure {
        List<Item> items = toItems(urls);
        JobMetadata metadata = new JobMetadata();
        metadata.setFileName(fileName);
        metadata.setImportedCount(items.size());
        metadata.setSkippedCount(urls.size() - items.size());

        Job job = persist(JobType.FILE_IMPORT, metadata, items);
        triggerPass();
        return job;
    }

    /**
     * Reset every failed item of a job for a fresh capture.
     *
     * @return number of items reset
     */
    public int retryFailed(String jobId) throws StorageFailure {
        int reset = jobRepository.retryFailedJobItems(jobId);
        if (reset > 0) {
            triggerPass();
        }
        return reset;
    }

    /**
     * Reset one item for a fresh capture, whatever its current status.
     *
     * @return false if the item does not exist
     */
    public boolean retryItem(String itemId) throws StorageFailure {
        boolean reset = jobRepository.retryItem(itemId);
        if (reset) {
            triggerPass();
        }
        return reset;
    }

    private List<Item> toItems(List<String> urls) {
        Set<String> accepted = new LinkedHashSet<>();
        for (String url : urls) {
            if (isValidUrl(url)) {
                accepted.add(url.trim());
            } else {
                logger.warning("Skipping invalid URL: " + url);
            }
        }
        if (accepted.isEmpty()) {
            throw new IllegalArgumentException("No valid URLs to enqueue");
        }
        List<Item> items = new ArrayList<>(accepted.size());
        for (String url : accepted) {
            items.add(newItem(url));
        }
        return items;
    }

    private Job persist(JobType type, JobMetadata metadata, List<Item> items) throws StorageFailure {
        LocalDateTime now = LocalDateTime.now();
        Job job = new Job();
        job.setId(UUID.randomUUID().toString());
        job.setType(type);
        job.setStatus(JobStatus.PENDING);
        job.setMetadata(metadata);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        jobRepository.createJob(job);

        List<JobItem> jobItems = new ArrayList<>(items.size());
        for (Item item : items) {
            itemRepository.createItem(item);
            jobItems.add(new JobItem(UUID.randomUUID().toString(), job.getId(), item.getId(),
                    JobItemStatus.PENDING, now));
        }
        jobRepository.createJobItems(jobItems);

        logger.info("Enqueued " + items.size() + " items as " + type + " job " + job.getId());
        return job;
    }

    private Item newItem(String url) {
        return new Item(UUID.randomUUID().toString(), url, null, ItemStatus.AWAITING_CAPTURE, LocalDateTime.now());
    }

    private void triggerPass() {
        try {
            triggerExecutor.execute(passTrigger);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Could not trigger a pass, the next scheduled pass will pick the items up", e);
        }
    }

    /**
     * @return true for absolute http or https URLs with a host
     */
    public static boolean isValidUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
