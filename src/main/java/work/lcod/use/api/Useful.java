package work.lcod.use.api;

/**
 * An object that shares its context, so libraries can accept either a {@link Context}
 * or anything exposing one.
 */
public interface Useful {
    Context use();
}
