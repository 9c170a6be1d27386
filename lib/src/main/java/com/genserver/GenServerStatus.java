package com.genserver;

/**
 * Lifecycle of a {@link GenServer}.
 *
 * <pre>
 * CREATED -> STARTING -> RUNNING -> STOPPING -> STOPPED
 *               |           |
 *               +-> FAILED <+
 * </pre>
 */
public enum GenServerStatus {
    /** Constructed, worker not spawned. */
    CREATED,
    /** Worker spawned, {@code init} in progress. */
    STARTING,
    /** Accepting casts and calls. */
    RUNNING,
    /** Stop requested; entries ahead of the stop signal are still being processed. */
    STOPPING,
    /** Worker exited after {@code terminate}. */
    STOPPED,
    /** {@code init} failed or the worker loop died unexpectedly. */
    FAILED;

    /**
     * Returns true once the server can never run again.
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
