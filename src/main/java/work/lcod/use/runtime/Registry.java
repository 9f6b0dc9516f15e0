package work.lcod.use.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.use.api.Factory;

/**
 * Key to entry store for one context, linked to the registry it was forked from.
 * Ancestors are only ever read; entries are materialized locally on first touch.
 */
final class Registry {
    private final Registry parent;
    private final Settings settings;
    private final Map<Object, Entry> entries = new LinkedHashMap<>();

    Registry(Registry parent, Settings settings) {
        this.parent = parent;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    static Registry root(Settings settings) {
        return new Registry(null, settings);
    }

    Registry child() {
        return new Registry(this, settings);
    }

    Settings settings() {
        return settings;
    }

    int depth() {
        int depth = 0;
        for (var r = parent; r != null; r = r.parent) {
            depth++;
        }
        return depth;
    }

    Entry lookupLocal(Object key) {
        return entries.get(key);
    }

    /**
     * Returns the local entry for a key, creating it from the nearest ancestor that has
     * one, or from the default policy when no ancestor does.
     */
    Entry materialize(Object key) {
        var entry = lookupLocal(key);
        if (entry != null) {
            return entry;
        }
        entry = newEntry(key);
        var inherited = findInherited(key);
        if (inherited != null) {
            entry.inheritFrom(inherited);
        } else {
            entry.assignFactory(settings.fallback());
        }
        entries.put(key, entry);
        return entry;
    }

    void setValue(Object key, Object value) {
        local(key).assignValue(value);
    }

    void define(Object key, Factory<?> factory) {
        local(key).assignFactory(factory);
    }

    Map<Object, Entry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    private Entry findInherited(Object key) {
        for (var r = parent; r != null; r = r.parent) {
            var candidate = r.lookupLocal(key);
            if (candidate != null && candidate.state() != EntryState.EMPTY) {
                return candidate;
            }
        }
        return null;
    }

    private Entry local(Object key) {
        return entries.computeIfAbsent(key, this::newEntry);
    }

    private Entry newEntry(Object key) {
        return new Entry(key, settings.tracer());
    }
}
