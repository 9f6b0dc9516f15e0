package work.lcod.use.api;

/**
 * Something that can be configured, looked up, and forked into child contexts.
 */
public interface Configurable {
    /**
     * Looks up the value for a key, creating it on first use.
     */
    Object invoke(Object key);

    /**
     * Looks up a class key, checking the value against the class.
     *
     * @throws ClassCastException if the value registered for the class is not an instance of it
     */
    default <T> T invoke(Class<T> key) {
        return key.cast(invoke((Object) key));
    }

    @SuppressWarnings("unchecked")
    default <T> T invoke(Key<T> key) {
        return (T) invoke((Object) key);
    }

    @SuppressWarnings("unchecked")
    default <T> T invoke(Recipe<T> key) {
        return (T) invoke((Object) key);
    }

    /**
     * Registers a factory for a key.
     *
     * @throws AlreadyReadException if the key was already read in this context
     */
    Configurable define(Object key, Factory<?> factory);

    /**
     * Registers a value for a key.
     *
     * @throws AlreadyReadException if the key was already read in this context
     */
    Configurable setValue(Object key, Object value);

    /**
     * Creates a child context that inherits this one's definitions.
     */
    Context fork();

    /**
     * Looks up a key in a brand-new child context.
     */
    default Object fork(Object key) {
        return fork().invoke(key);
    }

    default <T> T fork(Class<T> key) {
        return fork().invoke(key);
    }

    default <T> T fork(Key<T> key) {
        return fork().invoke(key);
    }

    default <T> T fork(Recipe<T> key) {
        return fork().invoke(key);
    }
}
