package com.capturequeue.engine;

import com.capturequeue.core.PipelineEvent;
import com.capturequeue.spi.EventSink;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventSink} that logs and drops anything the wrapped sink throws, so
 * event publication can never fail an item.
 */
final class GuardedEventSink implements EventSink {
    private static final Logger logger = Logger.getLogger(GuardedEventSink.class.getName());

    private final EventSink delegate;

    private GuardedEventSink(EventSink delegate) {
        this.delegate = delegate;
    }

    /**
     * @return the sink itself if it is already guarded, otherwise a guarding wrapper
     */
    static EventSink wrap(EventSink sink) {
        if (sink instanceof GuardedEventSink) {
            return sink;
        }
        return new GuardedEventSink(sink);
    }

    @Override
    public void publish(PipelineEvent event) {
        try {
            delegate.publish(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to publish " + event.getType() + " for item " + event.getItemId(), e);
        }
    }
}
