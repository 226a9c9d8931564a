package com.capturequeue.testutil;

import com.capturequeue.core.FetchFailure;
import com.capturequeue.core.FetchedContent;
import com.capturequeue.spi.ContentFetcher;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ContentFetcher} whose outcome per URL is scripted by the test.
 *
 * <p>By default every URL returns {@code <html><title>Title of URL</title>...}.
 * Scripted failures are consumed in order before the default kicks in; a URL
 * marked as always failing never succeeds. Tracks call counts and the highest
 * number of concurrent calls.</p>
 */
public class ScriptedFetcher implements ContentFetcher {
    private final Map<String, Deque<String>> failures = new ConcurrentHashMap<>();
    private final Map<String, String> alwaysFailing = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMs;

    public ScriptedFetcher failThenSucceed(String url, String... messages) {
        Deque<String> queue = new ArrayDeque<>();
        for (String message : messages) {
            queue.add(message);
        }
        failures.put(url, queue);
        return this;
    }

    public ScriptedFetcher alwaysFail(String url, String message) {
        alwaysFailing.put(url, message);
        return this;
    }

    public ScriptedFetcher withDelay(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    public int callsFor(String url) {
        AtomicInteger count = calls.get(url);
        return count != null ? count.get() : 0;
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    public static String htmlFor(String url) {
        return "<html><head><title>Title of " + url + "</title></head><body><h1>Heading</h1>"
                + "<p>Body of " + url + "</p></body></html>";
    }

    @Override
    public FetchedContent fetchContent(String url, Duration timeout) throws FetchFailure {
        calls.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchFailure(url, "interrupted", e);
                }
            }
            String always = alwaysFailing.get(url);
            if (always != null) {
                throw new FetchFailure(url, always);
            }
            Deque<String> queue = failures.get(url);
            if (queue != null) {
                String message;
                synchronized (queue) {
                    message = queue.poll();
                }
                if (message != null) {
                    throw new FetchFailure(url, message);
                }
            }
            return new FetchedContent(htmlFor(url), "Title of " + url);
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
