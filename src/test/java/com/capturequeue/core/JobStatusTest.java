package com.capturequeue.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void derivesStatusFromChildCounts() {
        assertEquals(JobStatus.COMPLETED, JobStatus.fromStats(new JobStats(0, 0, 0, 0)));
        assertEquals(JobStatus.PENDING, JobStatus.fromStats(new JobStats(3, 0, 0, 0)));
        assertEquals(JobStatus.IN_PROGRESS, JobStatus.fromStats(new JobStats(2, 1, 0, 0)));
        assertEquals(JobStatus.IN_PROGRESS, JobStatus.fromStats(new JobStats(1, 0, 2, 0)));
        assertEquals(JobStatus.IN_PROGRESS, JobStatus.fromStats(new JobStats(0, 1, 0, 1)));
        assertEquals(JobStatus.COMPLETED, JobStatus.fromStats(new JobStats(0, 0, 4, 0)));
        assertEquals(JobStatus.COMPLETED, JobStatus.fromStats(new JobStats(0, 0, 1, 3)));
        assertEquals(JobStatus.FAILED, JobStatus.fromStats(new JobStats(0, 0, 0, 2)));
    }

    @Test
    void statsCountJobItemsByStatus() {
        LocalDateTime now = LocalDateTime.now();
        JobStats stats = JobStats.of(List.of(
                new JobItem("1", "job", "a", JobItemStatus.PENDING, now),
                new JobItem("2", "job", "b", JobItemStatus.COMPLETE, now),
                new JobItem("3", "job", "c", JobItemStatus.COMPLETE, now),
                new JobItem("4", "job", "d", JobItemStatus.ERROR, now)));

        assertEquals(4, stats.getTotal());
        assertEquals(1, stats.getPending());
        assertEquals(2, stats.getComplete());
        assertEquals(1, stats.getError());
        assertEquals(75, stats.percentComplete());
    }

    @Test
    void itemTransitionsFollowThePipeline() {
        assertTrue(ItemStatus.AWAITING_CAPTURE.canTransitionTo(ItemStatus.CAPTURED));
        assertTrue(ItemStatus.CAPTURED.canTransitionTo(ItemStatus.PROCESSING));
        assertTrue(ItemStatus.PROCESSING.canTransitionTo(ItemStatus.AWAITING_PROCESSING));
        assertTrue(ItemStatus.PROCESSING.canTransitionTo(ItemStatus.COMPLETE));
        assertTrue(ItemStatus.ERROR.canTransitionTo(ItemStatus.AWAITING_CAPTURE));

        assertFalse(ItemStatus.AWAITING_CAPTURE.canTransitionTo(ItemStatus.COMPLETE));
        assertFalse(ItemStatus.CAPTURED.canTransitionTo(ItemStatus.COMPLETE));
        assertFalse(ItemStatus.COMPLETE.canTransitionTo(ItemStatus.ERROR));
        assertFalse(ItemStatus.ERROR.canTransitionTo(ItemStatus.PROCESSING));
    }

    @Test
    void itemUpdateOnlyTouchesSetFields() {
        Item item = new Item("x", "https://example.com", "Old", ItemStatus.AWAITING_CAPTURE, LocalDateTime.now());
        item.setErrorMessage("Retry 1/3: timeout");
        item.setRetryCount(1);

        ItemUpdate.create().status(ItemStatus.CAPTURED).content("<p>hi</p>").clearErrorMessage().applyTo(item);

        assertEquals(ItemStatus.CAPTURED, item.getStatus());
        assertEquals("<p>hi</p>", item.getContent());
        assertEquals("Old", item.getTitle());
        assertEquals(1, item.getRetryCount());
        assertNull(item.getErrorMessage());
    }
}
