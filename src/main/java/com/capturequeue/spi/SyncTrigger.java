package com.capturequeue.spi;

import com.capturequeue.core.SyncFailure;

/**
 * Post-pass hook that pushes results to a remote store when sync is enabled.
 */
public interface SyncTrigger {

    void triggerIfEnabled() throws SyncFailure;
}
