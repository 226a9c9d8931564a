package com.capturequeue.engine;

/**
 * What a crash recovery scan reset.
 */
public class RecoveryReport {
    private final int itemsReset;
    private final int jobItemsReset;
    private final int jobsRecomputed;

    public RecoveryReport(int itemsReset, int jobItemsReset, int jobsRecomputed) {
        this.itemsReset = itemsReset;
        this.jobItemsReset = jobItemsReset;
        this.jobsRecomputed = jobsRecomputed;
    }

    public int getItemsReset() { return itemsReset; }
    public int getJobItemsReset() { return jobItemsReset; }
    public int getJobsRecomputed() { return jobsRecomputed; }

    public boolean isEmpty() {
        return itemsReset == 0 && jobItemsReset == 0;
    }

    @Override
    public String toString() {
        return "RecoveryReport{itemsReset=" + itemsReset + ", jobItemsReset=" + jobItemsReset
                + ", jobsRecomputed=" + jobsRecomputed + "}";
    }
}
