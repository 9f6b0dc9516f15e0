package work.lcod.use.runtime;

/**
 * Receives entry state transitions. Must not perform lookups.
 */
@FunctionalInterface
public interface ResolutionTracer {
    ResolutionTracer NONE = (key, from, to) -> {};

    void onTransition(Object key, EntryState from, EntryState to);

    static ResolutionTracer stderr() {
        return (key, from, to) -> System.err.printf("use: %s %s -> %s%n", key, from, to);
    }
}
