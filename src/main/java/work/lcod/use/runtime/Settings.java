package work.lcod.use.runtime;

import java.util.Objects;
import work.lcod.use.api.Context;
import work.lcod.use.api.Factory;

/**
 * Configuration shared by every registry of one context tree.
 */
final class Settings {
    private final ResolutionTracer tracer;
    private final Factory<Object> fallback;

    Settings(DefaultResolutionPolicy policy, ResolutionTracer tracer) {
        Objects.requireNonNull(policy, "policy");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.fallback = new Factory<>() {
            @Override
            public Object create(Context context, Object key) throws Exception {
                return policy.resolve(context, key);
            }

            @Override
            public String toString() {
                return "default(" + policy + ")";
            }
        };
    }

    ResolutionTracer tracer() {
        return tracer;
    }

    Factory<Object> fallback() {
        return fallback;
    }
}
