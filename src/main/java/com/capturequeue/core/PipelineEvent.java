package com.capturequeue.core;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Transient notification about an item's progress.
 *
 * <p>Events are fire-and-forget: if nobody is listening they are dropped.
 * Equality ignores the timestamp so tests can compare against expected events.</p>
 */
public final class PipelineEvent {

    public enum Type {
        PROCESSING_STARTED,
        ITEM_READY,
        PROCESSING_FAILED
    }

    private final Type type;
    private final String itemId;
    private final String message;
    private final LocalDateTime timestamp;

    private PipelineEvent(Type type, String itemId, String message) {
        this.type = Objects.requireNonNull(type, "type");
        this.itemId = Objects.requireNonNull(itemId, "itemId");
        this.message = message;
        this.timestamp = LocalDateTime.now();
    }

    public static PipelineEvent processingStarted(String itemId) {
        return new PipelineEvent(Type.PROCESSING_STARTED, itemId, null);
    }

    public static PipelineEvent itemReady(String itemId) {
        return new PipelineEvent(Type.ITEM_READY, itemId, null);
    }

    public static PipelineEvent processingFailed(String itemId, String message) {
        return new PipelineEvent(Type.PROCESSING_FAILED, itemId, message);
    }

    public Type getType() { return type; }
    public String getItemId() { return itemId; }

    /**
     * @return the failure message for PROCESSING_FAILED, null otherwise
     */
    public String getMessage() { return message; }

    public LocalDateTime getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PipelineEvent)) {
            return false;
        }
        PipelineEvent other = (PipelineEvent) o;
        return type == other.type && itemId.equals(other.itemId) && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, itemId, message);
    }

    @Override
    public String toString() {
        return message == null
                ? type + "(" + itemId + ")"
                : type + "(" + itemId + ", " + message + ")";
    }
}
