package com.capturequeue.core;

/**
 * Raised by one of the content-processing stages.
 */
public class ProcessingFailure extends PipelineException {

    /** Processing stage that failed. */
    public enum Stage {
        MARKDOWN,
        QA,
        EMBED
    }

    private final Stage stage;

    public ProcessingFailure(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ProcessingFailure(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
