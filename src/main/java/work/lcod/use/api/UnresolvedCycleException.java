package work.lcod.use.api;

/**
 * Raised when a key's factory ends up reading the same key before returning.
 */
public final class UnresolvedCycleException extends ContextException {
    private final transient Factory<?> factory;

    public UnresolvedCycleException(Object key, Factory<?> factory) {
        super(key, "Factory " + factory + " didn't resolve " + key);
        this.factory = factory;
    }

    public Factory<?> factory() {
        return factory;
    }
}
