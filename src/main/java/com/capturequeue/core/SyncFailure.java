package com.capturequeue.core;

/**
 * Raised by the post-pass sync trigger. Never fails a pass.
 */
public class SyncFailure extends PipelineException {

    public SyncFailure(String message) {
        super(message);
    }

    public SyncFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
