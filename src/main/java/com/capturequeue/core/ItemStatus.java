package com.capturequeue.core;

/**
 * Lifecycle states of a captured page as it moves through the pipeline.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>AWAITING_CAPTURE → CAPTURED: raw content fetched</li>
 *   <li>AWAITING_CAPTURE → AWAITING_CAPTURE: fetch failed, retry scheduled</li>
 *   <li>CAPTURED / AWAITING_PROCESSING → PROCESSING: picked up by the processing phase</li>
 *   <li>PROCESSING → COMPLETE: markdown, Q&amp;A and embeddings stored</li>
 *   <li>PROCESSING → AWAITING_PROCESSING: processing failed, retry scheduled (or crash recovery)</li>
 *   <li>any active state → ERROR: retry budget exhausted</li>
 *   <li>ERROR → AWAITING_CAPTURE: manual retry</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @author Capture Queue Team
 * @see #canTransitionTo(ItemStatus)
 */
public enum ItemStatus {
    AWAITING_CAPTURE("Awaiting capture"),
    CAPTURED("Captured"),
    AWAITING_PROCESSING("Awaiting processing"),
    PROCESSING("Processing"),
    COMPLETE("Complete"),
    ERROR("Error");

    private final String displayName;

    ItemStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this status.
     *
     * @return the display name (e.g., "Captured", "Error")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this status is terminal for the pipeline.
     * Terminal items are never selected by either phase until they are
     * explicitly reset by a manual retry.
     *
     * @return true for COMPLETE and ERROR
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /**
     * Check if items in this status are eligible for the content processing phase.
     *
     * @return true for CAPTURED and AWAITING_PROCESSING
     */
    public boolean isReadyForProcessing() {
        return this == CAPTURED || this == AWAITING_PROCESSING;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p>Key Invariant: ERROR can only be left through a manual retry back to
     * AWAITING_CAPTURE, and COMPLETE can only be re-entered from PROCESSING.</p>
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(ItemStatus newStatus) {
        if (newStatus == ERROR) {
            return this != COMPLETE;
        }
        return switch (this) {
            case AWAITING_CAPTURE -> newStatus == AWAITING_CAPTURE || newStatus == CAPTURED;
            case CAPTURED, AWAITING_PROCESSING -> newStatus == PROCESSING || newStatus == AWAITING_CAPTURE;
            case PROCESSING -> newStatus == COMPLETE || newStatus == AWAITING_PROCESSING
                    || newStatus == AWAITING_CAPTURE;
            case COMPLETE -> newStatus == AWAITING_CAPTURE;
            case ERROR -> newStatus == AWAITING_CAPTURE;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
