package com.capturequeue.testutil;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.MarkdownRecord;
import com.capturequeue.core.QaRecord;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.ItemStorage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory {@link ItemStorage} that rejects illegal status
 * transitions and can be told to fail writes for chosen items.
 */
public class InMemoryItemStorage implements ItemStorage {
    private final Map<String, Item> items = new ConcurrentHashMap<>();
    private final Map<String, MarkdownRecord> markdown = new ConcurrentHashMap<>();
    private final Map<String, List<QaRecord>> qaPairs = new ConcurrentHashMap<>();
    private final Set<String> failingUpdates = ConcurrentHashMap.newKeySet();
    private final AtomicInteger statusQueries = new AtomicInteger();
    private final AtomicInteger failingStatusQueries = new AtomicInteger();
    private final List<String> transitions = new ArrayList<>();

    public void addItem(Item item) {
        items.put(item.getId(), new Item(item));
    }

    /**
     * @return a snapshot of the stored item, or null
     */
    public Item getItem(String itemId) {
        Item item = items.get(itemId);
        return item != null ? new Item(item) : null;
    }

    public void failUpdatesFor(String itemId) {
        failingUpdates.add(itemId);
    }

    public void clearFailures() {
        failingUpdates.clear();
        failingStatusQueries.set(0);
    }

    /**
     * Make the next {@code count} status queries throw.
     */
    public void failStatusQueries(int count) {
        failingStatusQueries.set(count);
    }

    public int getStatusQueryCount() {
        return statusQueries.get();
    }

    /**
     * @return "itemId:FROM->TO" for every status change, in order
     */
    public synchronized List<String> getTransitions() {
        return new ArrayList<>(transitions);
    }

    public void putMarkdown(String itemId, String content) {
        markdown.put(itemId, MarkdownRecord.of(itemId, content));
    }

    public void putQaPairs(String itemId, List<QaRecord> records) {
        qaPairs.put(itemId, new ArrayList<>(records));
    }

    @Override
    public synchronized void updateItem(String itemId, ItemUpdate update) throws StorageFailure {
        if (failingUpdates.contains(itemId)) {
            throw new StorageFailure("update", "items", "injected failure for " + itemId);
        }
        Item item = items.get(itemId);
        if (item == null) {
            throw new StorageFailure("update", "items", "no item with id " + itemId);
        }
        ItemStatus from = item.getStatus();
        ItemStatus to = update.getStatus();
        if (to != null && to != from) {
            if (!from.canTransitionTo(to)) {
                throw new IllegalStateException("Illegal transition " + from.name() + " -> " + to.name()
                        + " for item " + itemId);
            }
            transitions.add(itemId + ":" + from.name() + "->" + to.name());
        }
        update.applyTo(item);
    }

    @Override
    public List<Item> getItemsByStatus(ItemStatus status, int limit) throws StorageFailure {
        statusQueries.incrementAndGet();
        if (failingStatusQueries.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageFailure("select", "items", "injected failure");
        }
        List<Item> matching = items.values().stream()
                .filter(item -> item.getStatus() == status)
                .sorted(Comparator.comparing(Item::getCreatedAt).thenComparing(Item::getId))
                .map(Item::new)
                .collect(Collectors.toList());
        return limit > 0 && matching.size() > limit ? matching.subList(0, limit) : matching;
    }

    @Override
    public synchronized void bulkUpdateItems(Map<String, ItemUpdate> updates) throws StorageFailure {
        for (String itemId : updates.keySet()) {
            if (failingUpdates.contains(itemId) || !items.containsKey(itemId)) {
                throw new StorageFailure("bulk update", "items", "cannot update " + itemId);
            }
        }
        for (Map.Entry<String, ItemUpdate> entry : updates.entrySet()) {
            updateItem(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public MarkdownRecord getMarkdown(String itemId) {
        return markdown.get(itemId);
    }

    @Override
    public void saveMarkdown(MarkdownRecord record) throws StorageFailure {
        if (failingUpdates.contains(record.getItemId())) {
            throw new StorageFailure("merge", "markdown", "injected failure");
        }
        markdown.put(record.getItemId(), record);
    }

    @Override
    public List<QaRecord> getQaPairs(String itemId) {
        return new ArrayList<>(qaPairs.getOrDefault(itemId, List.of()));
    }

    @Override
    public void saveQaPairs(List<QaRecord> records) throws StorageFailure {
        for (QaRecord record : records) {
            if (failingUpdates.contains(record.getItemId())) {
                throw new StorageFailure("insert", "question_answers", "injected failure");
            }
        }
        for (QaRecord record : records) {
            qaPairs.computeIfAbsent(record.getItemId(), id -> new ArrayList<>()).add(record);
        }
    }
}
