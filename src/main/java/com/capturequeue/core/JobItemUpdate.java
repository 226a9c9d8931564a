package com.capturequeue.core;

import java.time.LocalDateTime;

/**
 * Partial update of a {@link JobItem}; unset fields keep their stored value.
 */
public class JobItemUpdate {
    private JobItemStatus status;
    private Integer retryCount;
    private String errorMessage;
    private boolean clearErrorMessage;
    private final LocalDateTime updatedAt = LocalDateTime.now();

    private JobItemUpdate() {
    }

    public static JobItemUpdate create() {
        return new JobItemUpdate();
    }

    public JobItemUpdate status(JobItemStatus status) {
        this.status = status;
        return this;
    }

    public JobItemUpdate retryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    public JobItemUpdate errorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        this.clearErrorMessage = false;
        return this;
    }

    public JobItemUpdate clearErrorMessage() {
        this.errorMessage = null;
        this.clearErrorMessage = true;
        return this;
    }

    public JobItemStatus getStatus() { return status; }
    public Integer getRetryCount() { return retryCount; }
    public String getErrorMessage() { return errorMessage; }
    public boolean isClearErrorMessage() { return clearErrorMessage; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public void applyTo(JobItem jobItem) {
        if (status != null) {
            jobItem.setStatus(status);
        }
        if (retryCount != null) {
            jobItem.setRetryCount(retryCount);
        }
        if (errorMessage != null || clearErrorMessage) {
            jobItem.setErrorMessage(errorMessage);
        }
        jobItem.setUpdatedAt(updatedAt);
    }

    @Override
    public String toString() {
        return "JobItemUpdate{status=" + status + ", retryCount=" + retryCount + ", errorMessage='" + errorMessage + "'}";
    }
}
