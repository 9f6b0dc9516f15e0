package work.lcod.use.runtime;

import work.lcod.use.api.Context;

/**
 * Fallback used when no context in the chain defines a key.
 */
@FunctionalInterface
public interface DefaultResolutionPolicy {
    Object resolve(Context context, Object key) throws Exception;
}
