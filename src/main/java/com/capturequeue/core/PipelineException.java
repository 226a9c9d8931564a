package com.capturequeue.core;

/**
 * Base class for failures raised while moving items through the pipeline.
 *
 * <p>Subclasses classify where the failure happened so the engine can decide
 * whether the item is retried, deferred, or reported.</p>
 */
public class PipelineException extends Exception {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
