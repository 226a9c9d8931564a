package com.capturequeue.core;

/**
 * Raised when a read or write against the backing store fails.
 *
 * <p>Carries the operation and table so log lines identify which write was lost.</p>
 */
public class StorageFailure extends PipelineException {
    private final String operation;
    private final String table;

    public StorageFailure(String operation, String table, String message) {
        super(operation + " on " + table + " failed: " + message);
        this.operation = operation;
        this.table = table;
    }

    public StorageFailure(String operation, String table, Throwable cause) {
        super(operation + " on " + table + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
        this.table = table;
    }

    public String getOperation() {
        return operation;
    }

    public String getTable() {
        return table;
    }
}
