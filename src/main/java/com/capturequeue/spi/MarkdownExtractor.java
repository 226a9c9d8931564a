package com.capturequeue.spi;

import com.capturequeue.core.ProcessingFailure;

/**
 * Converts captured page content to markdown.
 */
public interface MarkdownExtractor {

    String extract(String content, String url) throws ProcessingFailure;
}
