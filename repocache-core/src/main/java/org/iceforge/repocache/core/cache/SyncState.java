package org.iceforge.repocache.core.cache;

/**
 * Lifecycle of the background sync loop. Moves forward only; STOPPED is terminal.
 */
public enum SyncState {
    NEW,
    /** Startup hydration attempts in progress. */
    STARTING,
    /** Periodic hydration scheduled. */
    RUNNING,
    STOPPED
}
