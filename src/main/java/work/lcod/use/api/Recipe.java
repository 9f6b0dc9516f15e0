package work.lcod.use.api;

/**
 * A key that knows how to build its own value when no context defines one.
 */
@FunctionalInterface
public interface Recipe<T> {
    T create(Context context) throws Exception;
}
