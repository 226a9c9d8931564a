package com.capturequeue.testutil;

import com.capturequeue.config.PipelineConfig;
import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;

import java.time.LocalDateTime;

/**
 * Shared builders for engine tests.
 */
public final class Fixtures {
    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 12, 0);

    private Fixtures() {
    }

    /**
     * Fast config: 1 ms base delay, 4 ms cap, no jitter.
     */
    public static PipelineConfig config(int maxRetries, int fetchConcurrency) {
        return PipelineConfig.builder()
                .maxRetries(maxRetries)
                .baseDelayMs(1)
                .maxDelayMs(4)
                .jitterRatio(0.0)
                .fetchConcurrency(fetchConcurrency)
                .fetchTimeoutMs(1000)
                .build();
    }

    /**
     * Item created {@code minutesOld} minutes before a fixed base time.
     */
    public static Item item(String id, ItemStatus status, String content, int minutesOld) {
        Item item = new Item(id, "https://example.com/" + id, null, status, BASE_TIME.minusMinutes(minutesOld));
        item.setContent(content);
        return item;
    }

    public static Item awaitingCapture(String id) {
        return item(id, ItemStatus.AWAITING_CAPTURE, null, 0);
    }

    public static Item captured(String id, int minutesOld) {
        return item(id, ItemStatus.CAPTURED, "<p>content of " + id + "</p>", minutesOld);
    }
}
