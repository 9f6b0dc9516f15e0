package work.lcod.use.runtime;

import java.util.ArrayList;
import java.util.Objects;
import work.lcod.use.api.Context;
import work.lcod.use.api.ContextSnapshot;
import work.lcod.use.api.Factory;
import work.lcod.use.api.FactoryFailureException;
import work.lcod.use.api.UnresolvedCycleException;

/**
 * Context bound to its own registry. Each lookup drives the key's entry through its
 * states until it settles on a value or an error, both of which are then cached.
 */
public final class ScopedContext implements Context {
    private final Registry registry;

    ScopedContext(Registry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public Object invoke(Object key) {
        Objects.requireNonNull(key, "key");
        var entry = registry.materialize(key);
        for (;;) {
            switch (entry.state()) {
                case RESOLVED -> {
                    AmbientScope.record(this, key);
                    return entry.value();
                }
                case FAILED -> throw entry.error();
                case PENDING_VALUE -> revalidate(entry);
                case PENDING_FACTORY -> runFactory(entry, key);
                case RESOLVING -> entry.fail(new UnresolvedCycleException(key, entry.factory()));
                case EMPTY -> throw new IllegalStateException("Entry was never initialized: " + key);
            }
        }
    }

    @Override
    public ScopedContext define(Object key, Factory<?> factory) {
        Objects.requireNonNull(key, "key");
        registry.define(key, Objects.requireNonNull(factory, "factory"));
        return this;
    }

    @Override
    public ScopedContext setValue(Object key, Object value) {
        Objects.requireNonNull(key, "key");
        registry.setValue(key, value);
        return this;
    }

    @Override
    public ScopedContext fork() {
        return new ScopedContext(registry.child());
    }

    @Override
    public ContextSnapshot snapshot() {
        var entries = new ArrayList<ContextSnapshot.EntrySnapshot>();
        for (var entry : registry.entries().values()) {
            var value = entry.state() == EntryState.PENDING_VALUE || entry.state() == EntryState.RESOLVED
                ? entry.value()
                : null;
            var dependencies = new ArrayList<String>();
            if (entry.dependencies() != null) {
                for (Object dependency : entry.dependencies().keysRead()) {
                    dependencies.add(String.valueOf(dependency));
                }
            }
            entries.add(new ContextSnapshot.EntrySnapshot(
                String.valueOf(entry.key()),
                entry.state().name(),
                value == null ? null : value.getClass().getName(),
                dependencies
            ));
        }
        return new ContextSnapshot(registry.depth(), entries);
    }

    @Override
    public String toString() {
        return "Context(depth=" + registry.depth() + ")";
    }

    /**
     * Shares an inherited value only if every key its factory read still resolves to
     * the same instance here; otherwise rebuilds it locally from the same factory.
     */
    private void revalidate(Entry entry) {
        var dependencies = entry.dependencies();
        if (dependencies == null || AmbientScope.call(this, () -> dependencies.unchangedIn(this))) {
            entry.accept();
        } else {
            entry.invalidate();
        }
    }

    private void runFactory(Entry entry, Object key) {
        Factory<?> factory = entry.factory();
        entry.beginResolving();
        try {
            var outcome = AmbientScope.execute(this, factory, key);
            var keysRead = outcome.keysRead();
            entry.resolve(outcome.value(), keysRead.isEmpty() ? null : new Dependencies(this, factory, keysRead));
        } catch (RuntimeException ex) {
            failIfResolving(entry, ex);
        } catch (Exception ex) {
            failIfResolving(entry, new FactoryFailureException(key, ex));
        } catch (Error err) {
            if (entry.state() == EntryState.RESOLVING) {
                entry.abort(factory);
            }
            throw err;
        }
    }

    // a cycle detected inside the factory has already settled the entry
    private static void failIfResolving(Entry entry, RuntimeException failure) {
        if (entry.state() == EntryState.RESOLVING) {
            entry.fail(failure);
        }
    }
}
