package com.capturequeue.core;

/**
 * Status of one item's progress record within a job.
 *
 * <p>A job item mirrors its item's progress but uses a coarser vocabulary so
 * that job-level reporting can count children without knowing the pipeline's
 * internal states.</p>
 */
public enum JobItemStatus {
    PENDING("Pending"),
    IN_PROGRESS("In progress"),
    COMPLETE("Complete"),
    ERROR("Error");

    private final String displayName;

    JobItemStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return true for COMPLETE and ERROR
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
