package com.capturequeue.core;

import java.util.Collection;

/**
 * Child counts for one job, grouped by {@link JobItemStatus}.
 */
public class JobStats {
    private final int pending;
    private final int inProgress;
    private final int complete;
    private final int error;

    public JobStats(int pending, int inProgress, int complete, int error) {
        this.pending = pending;
        this.inProgress = inProgress;
        this.complete = complete;
        this.error = error;
    }

    /**
     * Count a collection of job items.
     *
     * @param jobItems the children of one job
     * @return the counts
     */
    public static JobStats of(Collection<JobItem> jobItems) {
        int pending = 0;
        int inProgress = 0;
        int complete = 0;
        int error = 0;
        for (JobItem jobItem : jobItems) {
            switch (jobItem.getStatus()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETE -> complete++;
                case ERROR -> error++;
            }
        }
        return new JobStats(pending, inProgress, complete, error);
    }

    public int getTotal() {
        return pending + inProgress + complete + error;
    }

    public int getPending() { return pending; }
    public int getInProgress() { return inProgress; }
    public int getComplete() { return complete; }
    public int getError() { return error; }

    /**
     * Share of children that reached a terminal state, as a whole percentage.
     *
     * @return 0-100; 100 for a job without children
     */
    public int percentComplete() {
        int total = getTotal();
        if (total == 0) {
            return 100;
        }
        return (int) Math.round((complete + error) * 100.0 / total);
    }

    @Override
    public String toString() {
        return "JobStats{total=" + getTotal() + ", pending=" + pending + ", inProgress=" + inProgress
                + ", complete=" + complete + ", error=" + error + "}";
    }
}
