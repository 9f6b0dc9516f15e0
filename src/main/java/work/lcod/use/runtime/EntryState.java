package work.lcod.use.runtime;

/**
 * Lifecycle of a key within one registry.
 */
public enum EntryState {
    EMPTY,
    PENDING_VALUE,
    PENDING_FACTORY,
    RESOLVING,
    RESOLVED,
    FAILED;

    /**
     * Whether the key has been read, so the entry no longer accepts writes.
     */
    public boolean isSettled() {
        return this == RESOLVING || this == RESOLVED || this == FAILED;
    }
}
