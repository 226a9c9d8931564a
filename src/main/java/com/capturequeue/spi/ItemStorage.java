package com.capturequeue.spi;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.MarkdownRecord;
import com.capturequeue.core.QaRecord;
import com.capturequeue.core.StorageFailure;

import java.util.List;
import java.util.Map;

/**
 * Persistent store for items and their derived content.
 *
 * <p>Implementations must be safe to call from several fetch threads at once.</p>
 */
public interface ItemStorage {

    /**
     * Apply a partial update to one item. Only fields set on the update are written.
     */
    void updateItem(String itemId, ItemUpdate update) throws StorageFailure;

    /**
     * Load items in a status, oldest created first.
     *
     * @param limit maximum number of items, or 0 for all
     */
    List<Item> getItemsByStatus(ItemStatus status, int limit) throws StorageFailure;

    default List<Item> getItemsByStatus(ItemStatus status) throws StorageFailure {
        return getItemsByStatus(status, 0);
    }

    /**
     * Apply several updates atomically, keyed by item id.
     */
    void bulkUpdateItems(Map<String, ItemUpdate> updates) throws StorageFailure;

    /**
     * @return the stored markdown, or null if none has been saved
     */
    MarkdownRecord getMarkdown(String itemId) throws StorageFailure;

    void saveMarkdown(MarkdownRecord record) throws StorageFailure;

    /**
     * @return stored pairs for the item, empty when none
     */
    List<QaRecord> getQaPairs(String itemId) throws StorageFailure;

    void saveQaPairs(List<QaRecord> records) throws StorageFailure;
}
