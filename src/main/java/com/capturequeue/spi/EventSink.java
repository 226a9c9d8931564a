package com.capturequeue.spi;

import com.capturequeue.core.PipelineEvent;

/**
 * Fire-and-forget event publication. Implementations never throw.
 */
public interface EventSink {

    void publish(PipelineEvent event);
}
