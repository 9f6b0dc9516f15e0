package work.lcod.use.runtime;

import java.util.List;
import work.lcod.use.api.Factory;

/**
 * How a cached value was produced: the context that ran the factory, the factory,
 * and the keys it read, in first-read order.
 */
record Dependencies(ScopedContext origin, Factory<?> factory, List<Object> keysRead) {
    Dependencies {
        keysRead = List.copyOf(keysRead);
    }

    /**
     * True when every key read by the factory resolves to the same instance in
     * {@code context} as it did in the origin context. Stops at the first mismatch.
     */
    boolean unchangedIn(ScopedContext context) {
        for (Object key : keysRead) {
            if (context.invoke(key) != origin.invoke(key)) {
                return false;
            }
        }
        return true;
    }
}
