package com.capturequeue.app;

/**
 * Overall state of the capture queue, derived from job counts.
 */
public class HealthStatus {

    public enum State {
        HEALTHY,
        PROCESSING,
        IDLE,
        ERROR
    }

    private final State state;
    private final String message;
    private final int pendingCount;
    private final int inProgressCount;
    private final int failedCount;
    private final boolean hasDetails;

    public HealthStatus(State state, String message, int pendingCount, int inProgressCount, int failedCount) {
        this.state = state;
        this.message = message;
        this.pendingCount = pendingCount;
        this.inProgressCount = inProgressCount;
        this.failedCount = failedCount;
        this.hasDetails = true;
    }

    private HealthStatus(State state, String message) {
        this.state = state;
        this.message = message;
        this.pendingCount = 0;
        this.inProgressCount = 0;
        this.failedCount = 0;
        this.hasDetails = false;
    }

    /**
     * Status reported when the counts themselves could not be read.
     */
    public static HealthStatus unavailable(String message) {
        return new HealthStatus(State.ERROR, message);
    }

    public State getState() { return state; }
    public String getMessage() { return message; }
    public int getPendingCount() { return pendingCount; }
    public int getInProgressCount() { return inProgressCount; }
    public int getFailedCount() { return failedCount; }

    /**
     * @return false when the counts could not be read
     */
    public boolean hasDetails() { return hasDetails; }

    @Override
    public String toString() {
        return state + ": " + message;
    }
}
