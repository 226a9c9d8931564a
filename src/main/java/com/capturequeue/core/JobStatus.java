package com.capturequeue.core;

/**
 * Aggregate status of a batch job.
 *
 * <p>A job's status is never set directly by the pipeline; it is derived from
 * its children's {@link JobItemStatus} counts through {@link #fromStats(JobStats)}.
 * CANCELLED is only ever set by the host.</p>
 *
 * <p>Derivation rules:</p>
 * <ul>
 *   <li>no children, or every child complete → COMPLETED</li>
 *   <li>no child pending or in progress, at least one error → COMPLETED when
 *       any child completed, otherwise FAILED</li>
 *   <li>every child still pending → PENDING</li>
 *   <li>any child pending or in progress → IN_PROGRESS</li>
 * </ul>
 */
public enum JobStatus {
    PENDING("Pending"),
    IN_PROGRESS("In progress"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return true if the job has reached a final state (COMPLETED, FAILED, or CANCELLED)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Derive the aggregate status of a job from its children.
     *
     * @param stats child counts for the job
     * @return the derived status
     */
    public static JobStatus fromStats(JobStats stats) {
        if (stats.getTotal() == 0 || stats.getComplete() == stats.getTotal()) {
            return COMPLETED;
        }
        if (stats.getError() > 0 && stats.getPending() == 0 && stats.getInProgress() == 0) {
            return stats.getComplete() > 0 ? COMPLETED : FAILED;
        }
        if (stats.getPending() == stats.getTotal()) {
            return PENDING;
        }
        if (stats.getPending() > 0 || stats.getInProgress() > 0) {
            return IN_PROGRESS;
        }
        return COMPLETED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
