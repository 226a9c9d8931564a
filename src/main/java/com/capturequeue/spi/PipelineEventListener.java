package com.capturequeue.spi;

import com.capturequeue.core.PipelineEvent;

/**
 * Observer of pipeline events.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event);
}
