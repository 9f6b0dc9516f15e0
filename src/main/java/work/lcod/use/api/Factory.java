package work.lcod.use.api;

/**
 * Produces the value for a key. Invoked lazily, at most once per key and context,
 * with the resolving context both passed in and installed as {@link Use#current()}.
 */
@FunctionalInterface
public interface Factory<T> {
    T create(Context context, Object key) throws Exception;
}
