package com.capturequeue.engine;

import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobStatus;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.testutil.Fixtures;
import com.capturequeue.testutil.InMemoryItemStorage;
import com.capturequeue.testutil.InMemoryJobTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrashRecoveryScannerTest {
    private InMemoryItemStorage storage;
    private InMemoryJobTracker jobTracker;
    private CrashRecoveryScanner scanner;

    @BeforeEach
    void setUp() {
        storage = new InMemoryItemStorage();
        jobTracker = new InMemoryJobTracker();
        scanner = new CrashRecoveryScanner(storage, jobTracker);
    }

    @Test
    void resetsStuckItemsAndJobItems() throws Exception {
        storage.addItem(Fixtures.item("with-content", ItemStatus.PROCESSING, "<p>x</p>", 0));
        storage.addItem(Fixtures.item("no-content", ItemStatus.PROCESSING, null, 0));
        storage.addItem(Fixtures.captured("untouched", 0));
        jobTracker.addJobItem("job-a", "with-content", JobItemStatus.IN_PROGRESS);
        jobTracker.addJobItem("job-a", "no-content", JobItemStatus.IN_PROGRESS);
        jobTracker.addJobItem("job-b", "untouched", JobItemStatus.COMPLETE);

        RecoveryReport report = scanner.recover();

        assertEquals(2, report.getItemsReset());
        assertEquals(2, report.getJobItemsReset());
        assertEquals(1, report.getJobsRecomputed());
        assertEquals(ItemStatus.AWAITING_PROCESSING, storage.getItem("with-content").getStatus());
        assertEquals(ItemStatus.AWAITING_CAPTURE, storage.getItem("no-content").getStatus());
        assertEquals(ItemStatus.CAPTURED, storage.getItem("untouched").getStatus());
        assertEquals(JobItemStatus.PENDING, jobTracker.getJobItemByItemId("with-content").getStatus());
        assertEquals(JobStatus.PENDING, jobTracker.getJobStatus("job-a"));
        assertFalse(jobTracker.getRecomputed().contains("job-b"));
    }

    @Test
    void cleanStoreReportsNothing() throws Exception {
        storage.addItem(Fixtures.captured("fine", 0));

        RecoveryReport report = scanner.recover();

        assertTrue(report.isEmpty());
        assertTrue(storage.getTransitions().isEmpty());
    }

    @Test
    void bulkResetIsAllOrNothing() {
        storage.addItem(Fixtures.item("one", ItemStatus.PROCESSING, "<p>1</p>", 0));
        storage.addItem(Fixtures.item("two", ItemStatus.PROCESSING, "<p>2</p>", 0));
        storage.failUpdatesFor("two");

        assertThrows(StorageFailure.class, () -> scanner.recover());

        assertEquals(ItemStatus.PROCESSING, storage.getItem("one").getStatus());
        assertEquals(ItemStatus.PROCESSING, storage.getItem("two").getStatus());
    }

    @Test
    void secondScanIsANoOp() throws Exception {
        storage.addItem(Fixtures.item("stuck", ItemStatus.PROCESSING, "<p>x</p>", 0));
        jobTracker.addJobItem("job", "stuck", JobItemStatus.IN_PROGRESS);

        assertFalse(scanner.recover().isEmpty());
        assertTrue(scanner.recover().isEmpty());
    }
}
