package com.capturequeue.db;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.MarkdownRecord;
import com.capturequeue.core.QaRecord;
import com.capturequeue.core.QuestionAnswer;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ItemRepositoryTest {
    private Database database;
    private ItemRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.create();
        repository = new ItemRepository(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private Item newItem(String id, ItemStatus status, int minutesOld) throws StorageFailure {
        Item item = new Item(id, "https://example.com/" + id, null, status,
                LocalDateTime.of(2024, 1, 1, 12, 0).minusMinutes(minutesOld));
        repository.createItem(item);
        return item;
    }

    @Test
    void createAndReadBack() throws Exception {
        newItem("a", ItemStatus.AWAITING_CAPTURE, 0);

        Item loaded = repository.getItemById("a");
        assertNotNull(loaded);
        assertEquals("https://example.com/a", loaded.getUrl());
        assertEquals(ItemStatus.AWAITING_CAPTURE, loaded.getStatus());
        assertEquals(0, loaded.getRetryCount());
        assertNull(loaded.getContent());
        assertNull(repository.getItemById("missing"));
    }

    @Test
    void updateWritesOnlySetFields() throws Exception {
        newItem("a", ItemStatus.AWAITING_CAPTURE, 0);
        repository.updateItem("a", ItemUpdate.create().retryCount(2).errorMessage("Retry 2/3: timeout"));

        repository.updateItem("a", ItemUpdate.create()
                .status(ItemStatus.CAPTURED)
                .content("<html>hi</html>")
                .title("Hi")
                .retryCount(0)
                .clearErrorMessage());

        Item loaded = repository.getItemById("a");
        assertEquals(ItemStatus.CAPTURED, loaded.getStatus());
        assertEquals("<html>hi</html>", loaded.getContent());
        assertEquals("Hi", loaded.getTitle());
        assertEquals(0, loaded.getRetryCount());
        assertNull(loaded.getErrorMessage());
        assertEquals("https://example.com/a", loaded.getUrl());
    }

    @Test
    void updatingUnknownItemFails() {
        StorageFailure failure = assertThrows(StorageFailure.class,
                () -> repository.updateItem("ghost", ItemUpdate.create().status(ItemStatus.ERROR)));
        assertEquals("items", failure.getTable());
    }

    @Test
    void statusQueryIsOldestFirstAndHonoursLimit() throws Exception {
        newItem("new", ItemStatus.CAPTURED, 1);
        newItem("old", ItemStatus.CAPTURED, 60);
        newItem("mid", ItemStatus.CAPTURED, 30);
        newItem("other", ItemStatus.ERROR, 90);

        List<Item> all = repository.getItemsByStatus(ItemStatus.CAPTURED);
        assertEquals(List.of("old", "mid", "new"), all.stream().map(Item::getId).collect(Collectors.toList()));

        List<Item> limited = repository.getItemsByStatus(ItemStatus.CAPTURED, 2);
        assertEquals(List.of("old", "mid"), limited.stream().map(Item::getId).collect(Collectors.toList()));
    }

    @Test
    void bulkUpdateAppliesEveryUpdate() throws Exception {
        newItem("a", ItemStatus.PROCESSING, 0);
        newItem("b", ItemStatus.PROCESSING, 0);
        Map<String, ItemUpdate> updates = new LinkedHashMap<>();
        updates.put("a", ItemUpdate.create().status(ItemStatus.AWAITING_PROCESSING));
        updates.put("b", ItemUpdate.create().status(ItemStatus.AWAITING_CAPTURE));

        repository.bulkUpdateItems(updates);

        assertEquals(ItemStatus.AWAITING_PROCESSING, repository.getItemById("a").getStatus());
        assertEquals(ItemStatus.AWAITING_CAPTURE, repository.getItemById("b").getStatus());
        Map<ItemStatus, Integer> counts = repository.countByStatus();
        assertEquals(0, counts.get(ItemStatus.PROCESSING));
        assertEquals(1, counts.get(ItemStatus.AWAITING_CAPTURE));
    }

    @Test
    void markdownIsOnePerItem() throws Exception {
        newItem("a", ItemStatus.PROCESSING, 0);
        assertNull(repository.getMarkdown("a"));

        repository.saveMarkdown(MarkdownRecord.of("a", "# first"));
        repository.saveMarkdown(MarkdownRecord.of("a", "# second"));

        assertEquals("# second", repository.getMarkdown("a").getContent());
    }

    @Test
    void qaPairsKeepTheirVectors() throws Exception {
        newItem("a", ItemStatus.PROCESSING, 0);
        assertTrue(repository.getQaPairs("a").isEmpty());

        repository.saveQaPairs(List.of(
                QaRecord.of("a", new QuestionAnswer("What?", "That."),
                        new float[] {0.5f, 1.5f}, new float[] {2f}, new float[] {3f, 4f, 5f}),
                QaRecord.of("a", new QuestionAnswer("Who?", "Them."),
                        new float[] {1f}, new float[] {1f}, new float[] {1f})));

        List<QaRecord> pairs = repository.getQaPairs("a");
        assertEquals(2, pairs.size());
        QaRecord what = pairs.stream().filter(p -> p.getQuestion().equals("What?")).findFirst().orElseThrow();
        assertEquals("That.", what.getAnswer());
        assertArrayEquals(new float[] {0.5f, 1.5f}, what.getEmbeddingQuestion());
        assertArrayEquals(new float[] {3f, 4f, 5f}, what.getEmbeddingBoth());
    }

    @Test
    void allQaPairsSpanEveryItem() throws Exception {
        newItem("a", ItemStatus.COMPLETE, 10);
        newItem("b", ItemStatus.COMPLETE, 0);
        repository.saveQaPairs(List.of(QaRecord.of("a", new QuestionAnswer("q1", "a1"),
                new float[] {1f}, new float[] {2f}, null)));
        repository.saveQaPairs(List.of(QaRecord.of("b", new QuestionAnswer("q2", "a2"),
                new float[] {3f}, new float[] {4f}, new float[] {5f})));

        List<QaRecord> all = repository.getAllQaPairs();

        assertEquals(2, all.size());
        assertEquals(List.of("a", "b"), all.stream().map(QaRecord::getItemId).sorted().collect(Collectors.toList()));
        QaRecord first = all.stream().filter(p -> p.getItemId().equals("a")).findFirst().orElseThrow();
        assertNull(first.getEmbeddingBoth());
    }

    @Test
    void qaBatchIsAllOrNothing() throws Exception {
        newItem("a", ItemStatus.PROCESSING, 0);
        QaRecord good = QaRecord.of("a", new QuestionAnswer("q", "a"), new float[] {1f}, new float[] {1f}, new float[] {1f});
        QaRecord orphan = QaRecord.of("no-such-item", new QuestionAnswer("q", "a"),
                new float[] {1f}, new float[] {1f}, new float[] {1f});

        assertThrows(StorageFailure.class, () -> repository.saveQaPairs(List.of(good, orphan)));

        assertTrue(repository.getQaPairs("a").isEmpty());
    }

    @Test
    void closedDatabaseSurfacesStorageFailure() {
        database.close();

        assertThrows(StorageFailure.class, () -> repository.getItemsByStatus(ItemStatus.CAPTURED));
    }
}
