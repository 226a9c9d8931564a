package com.capturequeue.app;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.Job;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.JobStatus;
import com.capturequeue.core.JobType;
import com.capturequeue.db.Database;
import com.capturequeue.db.ItemRepository;
import com.capturequeue.db.JobRepository;
import com.capturequeue.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CaptureServiceTest {
    private Database database;
    private ItemRepository items;
    private JobRepository jobs;
    private AtomicInteger passes;
    private CaptureService service;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.create();
        items = new ItemRepository(database);
        jobs = new JobRepository(database);
        passes = new AtomicInteger();
        service = new CaptureService(items, jobs, Runnable::run, passes::incrementAndGet);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void singleUrlBecomesUrlFetchJob() throws Exception {
        Job job = service.enqueueUrl("https://example.com/article");

        Job stored = jobs.getJob(job.getId());
        assertEquals(JobType.URL_FETCH, stored.getType());
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals("https://example.com/article", stored.getMetadata().getUrl());

        Item item = items.getItemById(stored.getMetadata().getItemId());
        assertEquals(ItemStatus.AWAITING_CAPTURE, item.getStatus());
        List<JobItem> children = jobs.getJobItems(job.getId());
        assertEquals(1, children.size());
        assertEquals(JobItemStatus.PENDING, children.get(0).getStatus());
    }

    @Test
    void invalidUrlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.enqueueUrl("ftp://example.com/file"));
        assertThrows(IllegalArgumentException.class, () -> service.enqueueUrl("not a url"));
        assertThrows(IllegalArgumentException.class, () -> service.enqueueUrl(null));
    }

    @Test
    void bulkImportSkipsInvalidAndDuplicateUrls() throws Exception {
        Job job = service.enqueueUrls(Arrays.asList(
                "https://example.com/a",
                "https://example.com/b",
                "https://example.com/a",
                "mailto:someone@example.com",
                ""));

        Job stored = jobs.getJob(job.getId());
        assertEquals(JobType.BULK_URL_IMPORT, stored.getType());
        assertEquals(5, stored.getMetadata().getTotalUrls());
        assertEquals(3, stored.getMetadata().getSkippedCount());
        assertEquals(2, jobs.getJobItems(job.getId()).size());
        assertEquals(2, items.getItemsByStatus(ItemStatus.AWAITING_CAPTURE).size());
    }

    @Test
    void bulkImportWithoutValidUrlsFails() {
        assertThrows(IllegalArgumentException.class,
                () -> service.enqueueUrls(List.of("nope", "javascript:alert(1)")));
    }

    @Test
    void fileImportRecordsFileName() throws Exception {
        Job job = service.enqueueImport("bookmarks.html", List.of("https://a.example", "https://b.example"));

        Job stored = jobs.getJob(job.getId());
        assertEquals(JobType.FILE_IMPORT, stored.getType());
        assertEquals("bookmarks.html", stored.getMetadata().getFileName());
        assertEquals(2, stored.getMetadata().getImportedCount());
        assertEquals(0, stored.getMetadata().getSkippedCount());
    }

    @Test
    void retryFailedTriggersAPassOnlyWhenSomethingWasReset() throws Exception {
        Job job = service.enqueueUrl("https://example.com/x");
        String itemId = jobs.getJob(job.getId()).getMetadata().getItemId();

        assertEquals(1, passes.get(), "enqueue triggers a pass");

        assertEquals(0, service.retryFailed(job.getId()));
        assertEquals(1, passes.get());

        items.updateItem(itemId, ItemUpdate.create().status(ItemStatus.ERROR).errorMessage("Failed after 4 attempts: x"));
        jobs.updateJobItemByItemId(itemId, JobItemUpdate.create().status(JobItemStatus.ERROR));

        assertEquals(1, service.retryFailed(job.getId()));
        assertEquals(2, passes.get());
        assertEquals(ItemStatus.AWAITING_CAPTURE, items.getItemById(itemId).getStatus());
    }

    @Test
    void retryItemReportsUnknownItems() throws Exception {
        Job job = service.enqueueUrl("https://example.com/y");
        String itemId = jobs.getJob(job.getId()).getMetadata().getItemId();

        assertTrue(service.retryItem(itemId));
        assertFalse(service.retryItem("missing"));
        assertEquals(2, passes.get());
    }

    @Test
    void rejectedTriggerIsNotAnError() throws Exception {
        CaptureService closed = new CaptureService(items, jobs, command -> {
            throw new RejectedExecutionException("shut down");
        }, passes::incrementAndGet);
        Job job = closed.enqueueUrl("https://example.com/z");

        assertDoesNotThrow(() -> closed.retryItem(jobs.getJob(job.getId()).getMetadata().getItemId()));
    }

    @Test
    void urlValidation() {
        assertTrue(CaptureService.isValidUrl("http://example.com"));
        assertTrue(CaptureService.isValidUrl(" https://example.com/path?q=1 "));
        assertFalse(CaptureService.isValidUrl("https://"));
        assertFalse(CaptureService.isValidUrl("/relative/path"));
        assertFalse(CaptureService.isValidUrl("   "));
    }
}
