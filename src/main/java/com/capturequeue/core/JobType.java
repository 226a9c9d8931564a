package com.capturequeue.core;

/**
 * Kinds of batch jobs the host creates when it enqueues items.
 */
public enum JobType {
    /** Items imported from a bookmarks file. */
    FILE_IMPORT,
    /** Several URLs submitted together. */
    BULK_URL_IMPORT,
    /** A single URL captured on demand. */
    URL_FETCH
}
