package com.capturequeue.spi;

import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.StorageFailure;

import java.util.List;

/**
 * Job and job-item bookkeeping used by the engine.
 */
public interface JobTracker {

    /**
     * Update the most recent job item for an item. Does nothing if the item
     * belongs to no job.
     */
    void updateJobItemByItemId(String itemId, JobItemUpdate update) throws StorageFailure;

    /**
     * @return the most recent job item for the item, or null if none
     */
    JobItem getJobItemByItemId(String itemId) throws StorageFailure;

    /**
     * Re-derive a job's status from its children.
     */
    void recomputeJobStatus(String jobId) throws StorageFailure;

    List<JobItem> getJobItemsByStatus(JobItemStatus status) throws StorageFailure;

    void updateJobItem(String jobItemId, JobItemUpdate update) throws StorageFailure;
}
