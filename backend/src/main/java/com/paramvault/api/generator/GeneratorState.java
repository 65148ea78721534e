package com.paramvault.api.generator;

/**
 * Lifecycle of the external generator process.
 * <pre>
 * STOPPED -> STARTING -> READY <-> BUSY
 * READY/BUSY -> STOPPING -> STOPPED
 * STARTING/READY/BUSY -> FAILED (next request restarts)
 * </pre>
 */
public enum GeneratorState {
    STOPPED,
    STARTING,
    READY,
    BUSY,
    STOPPING,
    FAILED;

    public boolean isLive() {
        return this == READY || this == BUSY;
    }
}
