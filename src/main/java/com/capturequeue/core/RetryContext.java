package com.capturequeue.core;

/**
 * Input to a single retry decision. Never persisted.
 *
 * @see com.capturequeue.engine.RetryCoordinator
 */
public class RetryContext {
    private final Item item;
    private final int currentRetryCount;
    private final int maxRetries;

    public RetryContext(Item item, int currentRetryCount, int maxRetries) {
        if (currentRetryCount < 0) {
            throw new IllegalArgumentException("currentRetryCount must be >= 0: " + currentRetryCount);
        }
        this.item = item;
        this.currentRetryCount = currentRetryCount;
        this.maxRetries = maxRetries;
    }

    /**
     * Build the context for an item from its stored retry count.
     *
     * @param item the item whose attempt failed
     * @param maxRetries configured retry budget
     * @return the context
     */
    public static RetryContext forItem(Item item, int maxRetries) {
        return new RetryContext(item, item.getRetryCount(), maxRetries);
    }

    public Item getItem() { return item; }
    public int getCurrentRetryCount() { return currentRetryCount; }
    public int getMaxRetries() { return maxRetries; }

    /**
     * @return true while the retry budget still allows another attempt
     */
    public boolean hasRetriesLeft() {
        return currentRetryCount < maxRetries;
    }

    @Override
    public String toString() {
        return "RetryContext{itemId='" + item.getId() + "', attempt=" + currentRetryCount + "/" + maxRetries + "}";
    }
}
