package work.lcod.use.api;

/**
 * The root of a context tree. It holds global defaults and forks top-level contexts,
 * but never resolves anything itself: lookups go to whichever context is currently
 * running a factory.
 */
public interface GlobalContext extends Configurable {
    /**
     * Returns the context whose factory is currently executing on this thread. The
     * slot is shared by every root, so inside a factory of another tree this is that
     * tree's context.
     *
     * @throws NoActiveContextException outside of any factory
     */
    Context current();

    /**
     * Type a key implements to act as its own default factory.
     */
    default Class<?> defaultFactoryToken() {
        return Recipe.class;
    }

    @Override
    GlobalContext define(Object key, Factory<?> factory);

    @Override
    GlobalContext setValue(Object key, Object value);
}
