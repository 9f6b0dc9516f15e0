package work.lcod.use.api;

/**
 * Carries a checked exception thrown by a factory. Created once per failed entry, so
 * every later lookup of the key rethrows this same instance.
 */
public final class FactoryFailureException extends ContextException {
    public FactoryFailureException(Object key, Exception cause) {
        super(key, "Factory for " + key + " failed: " + cause.getMessage(), cause);
    }
}
