package com.capturequeue.engine;

import com.capturequeue.core.PipelineEvent;
import com.capturequeue.spi.PipelineEventListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBroadcasterTest {
    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new EventBroadcaster();
    }

    @AfterEach
    void tearDown() {
        broadcaster.shutdown();
    }

    @Test
    void deliversEventsInPublishOrder() throws Exception {
        List<PipelineEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        broadcaster.addListener(event -> {
            received.add(event);
            latch.countDown();
        });

        broadcaster.publish(PipelineEvent.processingStarted("a"));
        broadcaster.publish(PipelineEvent.itemReady("a"));
        broadcaster.publish(PipelineEvent.processingFailed("b", "Failed after 4 attempts: timeout"));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(
                PipelineEvent.processingStarted("a"),
                PipelineEvent.itemReady("a"),
                PipelineEvent.processingFailed("b", "Failed after 4 attempts: timeout")), received);
        assertEquals("Failed after 4 attempts: timeout", received.get(2).getMessage());
    }

    @Test
    void publishDoesNotWaitForSlowListeners() {
        CountDownLatch release = new CountDownLatch(1);
        broadcaster.addListener(event -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        long start = System.nanoTime();
        for (int i = 0; i < 10; i++) {
            broadcaster.publish(PipelineEvent.itemReady("item-" + i));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        release.countDown();

        assertTrue(elapsedMs < 1000, "publish blocked for " + elapsedMs + " ms");
    }

    @Test
    void failingListenerDoesNotStopOthers() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        broadcaster.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        broadcaster.addListener(event -> latch.countDown());

        broadcaster.publish(PipelineEvent.itemReady("x"));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void removedListenerStopsReceiving() throws Exception {
        List<PipelineEvent> received = new CopyOnWriteArrayList<>();
        PipelineEventListener listener = received::add;
        broadcaster.addListener(listener);
        assertEquals(1, broadcaster.getListenerCount());

        broadcaster.removeListener(listener);
        broadcaster.publish(PipelineEvent.itemReady("ignored"));
        broadcaster.shutdown();

        assertEquals(0, broadcaster.getListenerCount());
        assertTrue(received.isEmpty());
    }

    @Test
    void publishAfterShutdownIsDropped() {
        broadcaster.addListener(event -> { });
        broadcaster.shutdown();

        assertDoesNotThrow(() -> broadcaster.publish(PipelineEvent.itemReady("late")));
    }
}
