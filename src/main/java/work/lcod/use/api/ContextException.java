package work.lcod.use.api;

/**
 * Base type for failures raised while configuring or resolving a key.
 */
public class ContextException extends RuntimeException {
    private final transient Object key;

    public ContextException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public ContextException(Object key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * Key being configured or resolved, or {@code null} when no key was involved.
     */
    public Object key() {
        return key;
    }
}
