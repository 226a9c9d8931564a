package com.capturequeue.core;

import java.time.LocalDateTime;

/**
 * Per-item progress record within a batch {@link Job}.
 *
 * <p>Distinct from the item's own status so that job-level reporting
 * (percentage complete, success and failure counts) never needs to look at
 * item rows.</p>
 */
public class JobItem {
    private String id;
    private String jobId;
    private String itemId;
    private JobItemStatus status;
    private int retryCount;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public JobItem() {
    }

    public JobItem(String id, String jobId, String itemId, JobItemStatus status, LocalDateTime createdAt) {
        this.id = id;
        this.jobId = jobId;
        this.itemId = itemId;
        this.status = status;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public JobItem(JobItem other) {
        this.id = other.id;
        this.jobId = other.jobId;
        this.itemId = other.itemId;
        this.status = other.status;
        this.retryCount = other.retryCount;
        this.errorMessage = other.errorMessage;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }

    public JobItemStatus getStatus() { return status; }
    public void setStatus(JobItemStatus status) { this.status = status; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "JobItem{id='" + id + "', jobId='" + jobId + "', itemId='" + itemId + "', status=" + status + "}";
    }
}
