package com.capturequeue.core;

import java.time.LocalDateTime;

/**
 * Partial update of an {@link Item}.
 *
 * <p>Only the fields that were set are written; everything else keeps its
 * stored value. {@code updatedAt} is always written and defaults to the
 * moment the update was created.</p>
 *
 * <pre>{@code
 * storage.updateItem(item.getId(), ItemUpdate.create()
 *         .status(ItemStatus.CAPTURED)
 *         .content(html)
 *         .retryCount(0)
 *         .clearErrorMessage());
 * }</pre>
 */
public class ItemUpdate {
    private ItemStatus status;
    private String title;
    private String content;
    private Integer retryCount;
    private String errorMessage;
    private boolean clearErrorMessage;
    private LocalDateTime updatedAt = LocalDateTime.now();

    private ItemUpdate() {
    }

    public static ItemUpdate create() {
        return new ItemUpdate();
    }

    public ItemUpdate status(ItemStatus status) {
        this.status = status;
        return this;
    }

    public ItemUpdate title(String title) {
        this.title = title;
        return this;
    }

    public ItemUpdate content(String content) {
        this.content = content;
        return this;
    }

    public ItemUpdate retryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    public ItemUpdate errorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        this.clearErrorMessage = false;
        return this;
    }

    /**
     * Explicitly null out the stored error message.
     *
     * @return this update
     */
    public ItemUpdate clearErrorMessage() {
        this.errorMessage = null;
        this.clearErrorMessage = true;
        return this;
    }

    public ItemUpdate updatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
        return this;
    }

    public ItemStatus getStatus() { return status; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public Integer getRetryCount() { return retryCount; }
    public String getErrorMessage() { return errorMessage; }
    public boolean isClearErrorMessage() { return clearErrorMessage; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    /**
     * Apply the set fields to an in-memory item.
     *
     * @param item the item to mutate
     */
    public void applyTo(Item item) {
        if (status != null) {
            item.setStatus(status);
        }
        if (title != null) {
            item.setTitle(title);
        }
        if (content != null) {
            item.setContent(content);
        }
        if (retryCount != null) {
            item.setRetryCount(retryCount);
        }
        if (errorMessage != null || clearErrorMessage) {
            item.setErrorMessage(errorMessage);
        }
        item.setUpdatedAt(updatedAt);
    }

    @Override
    public String toString() {
        return "ItemUpdate{status=" + status + ", retryCount=" + retryCount
                + ", errorMessage='" + errorMessage + "', clearErrorMessage=" + clearErrorMessage + "}";
    }
}
