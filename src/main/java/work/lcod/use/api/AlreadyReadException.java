package work.lcod.use.api;

/**
 * Raised when a key is reconfigured after it was read in the same context.
 */
public final class AlreadyReadException extends ContextException {
    public AlreadyReadException(Object key) {
        super(key, "Already read: " + key);
    }
}
