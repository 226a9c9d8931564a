package com.capturequeue.core;

import java.time.LocalDateTime;

/**
 * A captured web page progressing through the pipeline.
 *
 * <p>Items are plain data holders. They are loaded by {@code ItemStorage},
 * handed to exactly one phase at a time, and mutated in storage through
 * {@link ItemUpdate} rather than through these setters.</p>
 *
 * <p><b>Invariants:</b></p>
 * <ul>
 *   <li>{@code retryCount} is reset to 0 whenever the item succeeds</li>
 *   <li>{@code errorMessage} is cleared whenever the item leaves ERROR</li>
 * </ul>
 *
 * @author Capture Queue Team
 */
public class Item {
    private String id;
    private String url;
    private String title;
    private String content;
    private ItemStatus status;
    private int retryCount;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Item() {
    }

    public Item(String id, String url, String title, ItemStatus status, LocalDateTime createdAt) {
        this.id = id;
        this.url = url;
        this.title = title;
        this.status = status;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Copy constructor, used where a snapshot must not share state with the stored item.
     *
     * @param other the item to copy
     */
    public Item(Item other) {
        this.id = other.id;
        this.url = other.url;
        this.title = other.title;
        this.content = other.content;
        this.status = other.status;
        this.retryCount = other.retryCount;
        this.errorMessage = other.errorMessage;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public ItemStatus getStatus() { return status; }
    public void setStatus(ItemStatus status) { this.status = status; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    /**
     * Check whether raw content has been captured for this item.
     *
     * @return true if content is present and non-empty
     */
    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    /**
     * Name used in log lines: the title when known, otherwise the URL.
     *
     * @return a non-null label for this item
     */
    public String getDisplayName() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return url != null ? url : id;
    }

    @Override
    public String toString() {
        return "Item{id='" + id + "', url='" + url + "', status=" + status + ", retryCount=" + retryCount + "}";
    }
}
