package com.capturequeue.engine;

import com.capturequeue.core.PipelineEvent;
import com.capturequeue.spi.EventSink;
import com.capturequeue.spi.PipelineEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort, non-blocking delivery of pipeline events to zero or more listeners.
 *
 * <p>Events are handed to a single daemon dispatcher thread, so listeners see
 * them in publish order and a slow listener never blocks the pipeline. With no
 * listener registered an event is simply dropped. A listener that throws is
 * logged and the remaining listeners still receive the event.</p>
 *
 * <p><b>Thread Safety:</b> Listeners may be added or removed from any thread
 * while events are being delivered.</p>
 *
 * @author Capture Queue Team
 */
public class EventBroadcaster implements EventSink {
    private static final Logger logger = Logger.getLogger(EventBroadcaster.class.getName());

    private final List<PipelineEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;

    public EventBroadcaster() {
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(PipelineEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PipelineEventListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    @Override
    public void publish(PipelineEvent event) {
        if (listeners.isEmpty()) {
            logger.finest("No listeners, dropping " + event);
            return;
        }
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            logger.warning("Broadcaster shut down, dropping " + event);
        }
    }

    private void deliver(PipelineEvent event) {
        for (PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Listener failed on " + event, e);
            }
        }
    }

    /**
     * Stop the dispatcher after delivering already published events.
     */
    public void shutdown() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
