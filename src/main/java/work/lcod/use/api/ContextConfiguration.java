package work.lcod.use.api;

import java.util.Objects;
import work.lcod.use.runtime.DefaultResolutionPolicy;
import work.lcod.use.runtime.ResolutionTracer;
import work.lcod.use.runtime.StandardResolutionPolicy;

/**
 * Immutable settings for a context tree, fixed when its root is created.
 */
public record ContextConfiguration(DefaultResolutionPolicy policy, ResolutionTracer tracer) {
    public static final String TRACE_PROPERTY = "lcod.use.trace";

    public ContextConfiguration {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Standard policy; tracing to stderr when {@value #TRACE_PROPERTY} is set.
     */
    public static ContextConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DefaultResolutionPolicy policy = StandardResolutionPolicy.INSTANCE;
        private ResolutionTracer tracer = Boolean.getBoolean(TRACE_PROPERTY)
            ? ResolutionTracer.stderr()
            : ResolutionTracer.NONE;

        public Builder policy(DefaultResolutionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder tracer(ResolutionTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public ContextConfiguration build() {
            return new ContextConfiguration(policy, tracer);
        }
    }
}
