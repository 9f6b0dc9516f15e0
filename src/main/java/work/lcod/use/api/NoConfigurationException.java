package work.lcod.use.api;

/**
 * Raised when nothing defines a key and it cannot be built by default.
 */
public final class NoConfigurationException extends ContextException {
    public NoConfigurationException(Object key) {
        super(key, "No config for " + key);
    }
}
