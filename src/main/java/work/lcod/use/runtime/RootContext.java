package work.lcod.use.runtime;

import java.util.Objects;
import work.lcod.use.api.Context;
import work.lcod.use.api.ContextConfiguration;
import work.lcod.use.api.Factory;
import work.lcod.use.api.GlobalContext;
import work.lcod.use.api.NoActiveContextException;

/**
 * Root of a context tree. Its registry only holds defaults for descendants; lookups
 * are always answered by the context currently running a factory.
 */
public final class RootContext implements GlobalContext {
    private final Registry registry;

    private RootContext(Registry registry) {
        this.registry = registry;
    }

    public static RootContext create(ContextConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        var settings = new Settings(configuration.policy(), configuration.tracer());
        return new RootContext(Registry.root(settings));
    }

    @Override
    public Object invoke(Object key) {
        return current().invoke(key);
    }

    @Override
    public Context current() {
        var active = AmbientScope.current();
        if (active == null) {
            throw new NoActiveContextException();
        }
        return active;
    }

    @Override
    public RootContext define(Object key, Factory<?> factory) {
        Objects.requireNonNull(key, "key");
        registry.define(key, Objects.requireNonNull(factory, "factory"));
        return this;
    }

    @Override
    public RootContext setValue(Object key, Object value) {
        Objects.requireNonNull(key, "key");
        registry.setValue(key, value);
        return this;
    }

    @Override
    public ScopedContext fork() {
        return new ScopedContext(registry.child());
    }

    @Override
    public String toString() {
        return "GlobalContext";
    }
}
