package work.lcod.use.api;

/**
 * Lookup handle bound to a single registry. Values are created lazily, cached for
 * the lifetime of the context, and shared with child contexts as long as everything
 * they were built from resolves identically there.
 */
public interface Context extends Configurable, Useful {
    @Override
    Context define(Object key, Factory<?> factory);

    @Override
    Context setValue(Object key, Object value);

    /**
     * Describes the entries materialized in this context, without resolving anything.
     */
    ContextSnapshot snapshot();

    @Override
    default Context use() {
        return this;
    }
}
