package com.capturequeue.core;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Markdown extracted from an item's captured content. At most one per item.
 */
public class MarkdownRecord {
    private final String id;
    private final String itemId;
    private final String content;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public MarkdownRecord(String id, String itemId, String content, LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.itemId = itemId;
        this.content = content;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Create a fresh record with a generated id.
     */
    public static MarkdownRecord of(String itemId, String content) {
        LocalDateTime now = LocalDateTime.now();
        return new MarkdownRecord(UUID.randomUUID().toString(), itemId, content, now, now);
    }

    public String getId() { return id; }
    public String getItemId() { return itemId; }
    public String getContent() { return content; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
