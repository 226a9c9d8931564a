package com.capturequeue.core;

/**
 * Result of fetching one URL: the raw content and, when the page declares
 * one, its title.
 */
public final class FetchedContent {
    private final String content;
    private final String title;

    public FetchedContent(String content, String title) {
        this.content = content;
        this.title = title;
    }

    public String getContent() { return content; }

    /**
     * @return the page title, or null if none was found
     */
    public String getTitle() { return title; }
}
