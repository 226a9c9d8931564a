package com.capturequeue.core;

/**
 * Raised when a URL could not be fetched: network error, timeout,
 * non-2xx response, or oversized content.
 */
public class FetchFailure extends PipelineException {
    private final String url;

    public FetchFailure(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchFailure(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /**
     * @return the URL that failed, may be null when unknown
     */
    public String getUrl() {
        return url;
    }
}
