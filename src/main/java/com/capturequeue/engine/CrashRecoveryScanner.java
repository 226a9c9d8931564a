package com.capturequeue.engine;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.ItemStorage;
import com.capturequeue.spi.JobTracker;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reconciles items left in flight by a process that died mid-pass.
 *
 * <p>Run once per process start, before the first pass:</p>
 * <ul>
 *   <li>PROCESSING items go back to AWAITING_PROCESSING, or to AWAITING_CAPTURE
 *       when no content was captured, in one bulk update</li>
 *   <li>IN_PROGRESS job items go back to PENDING and their jobs are recomputed</li>
 * </ul>
 *
 * <p>Re-running a partially processed item is safe because every processing
 * stage checks for stored output before doing work.</p>
 *
 * @author Capture Queue Team
 */
public class CrashRecoveryScanner {
    private static final Logger logger = Logger.getLogger(CrashRecoveryScanner.class.getName());

    private final ItemStorage storage;
    private final JobTracker jobTracker;

    public CrashRecoveryScanner(ItemStorage storage, JobTracker jobTracker) {
        this.storage = storage;
        this.jobTracker = jobTracker;
    }

    /**
     * Reset stuck items and job items.
     *
     * @return what was reset
     * @throws StorageFailure if the scan or the reset failed
     */
    public RecoveryReport recover() throws StorageFailure {
        List<Item> stuck = storage.getItemsByStatus(ItemStatus.PROCESSING);
        Map<String, ItemUpdate> resets = new LinkedHashMap<>();
        for (Item item : stuck) {
            ItemStatus resumeStatus = item.hasContent() ? ItemStatus.AWAITING_PROCESSING : ItemStatus.AWAITING_CAPTURE;
            resets.put(item.getId(), ItemUpdate.create().status(resumeStatus));
        }
        if (!resets.isEmpty()) {
            storage.bulkUpdateItems(resets);
        }

        List<JobItem> inProgress = jobTracker.getJobItemsByStatus(JobItemStatus.IN_PROGRESS);
        Set<String> affectedJobs = new LinkedHashSet<>();
        for (JobItem jobItem : inProgress) {
            jobTracker.updateJobItem(jobItem.getId(), JobItemUpdate.create().status(JobItemStatus.PENDING));
            affectedJobs.add(jobItem.getJobId());
        }
        for (String jobId : affectedJobs) {
            jobTracker.recomputeJobStatus(jobId);
        }

        RecoveryReport report = new RecoveryReport(resets.size(), inProgress.size(), affectedJobs.size());
        if (report.isEmpty()) {
            logger.info("Crash recovery: nothing to reset");
        } else {
            logger.info("Crash recovery: " + report);
        }
        return report;
    }
}
