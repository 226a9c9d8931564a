package com.capturequeue.spi;

import com.capturequeue.core.FetchFailure;
import com.capturequeue.core.FetchedContent;

import java.time.Duration;

/**
 * Downloads the raw content of a URL.
 */
public interface ContentFetcher {

    FetchedContent fetchContent(String url, Duration timeout) throws FetchFailure;
}
