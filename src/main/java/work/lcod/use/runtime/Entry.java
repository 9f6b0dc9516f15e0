package work.lcod.use.runtime;

import work.lcod.use.api.AlreadyReadException;
import work.lcod.use.api.Factory;

/**
 * Per-key resolution record owned by a single {@link Registry}.
 */
final class Entry {
    private final Object key;
    private final ResolutionTracer tracer;
    private EntryState state = EntryState.EMPTY;
    private Object value;
    private Factory<?> factory;
    private RuntimeException error;
    private Dependencies dependencies;

    Entry(Object key, ResolutionTracer tracer) {
        this.key = key;
        this.tracer = tracer;
    }

    Object key() {
        return key;
    }

    EntryState state() {
        return state;
    }

    Object value() {
        return value;
    }

    Factory<?> factory() {
        return factory;
    }

    RuntimeException error() {
        return error;
    }

    Dependencies dependencies() {
        return dependencies;
    }

    void assignValue(Object newValue) {
        ensureWritable();
        value = newValue;
        factory = null;
        dependencies = null;
        moveTo(EntryState.PENDING_VALUE);
    }

    void assignFactory(Factory<?> newFactory) {
        ensureWritable();
        value = null;
        factory = newFactory;
        dependencies = null;
        moveTo(EntryState.PENDING_FACTORY);
    }

    /**
     * Copies an ancestor's entry into a registry that has not touched the key yet.
     * Resolved values come back pending so the child can still validate them; an
     * ancestor still resolving stays resolving, so reading it fails as a cycle.
     */
    Entry inheritFrom(Entry ancestor) {
        value = ancestor.value;
        factory = ancestor.factory;
        error = ancestor.error;
        dependencies = ancestor.dependencies;
        moveTo(switch (ancestor.state) {
            case RESOLVED -> EntryState.PENDING_VALUE;
            default -> ancestor.state;
        });
        return this;
    }

    void beginResolving() {
        moveTo(EntryState.RESOLVING);
    }

    /**
     * Stores a factory result. A cycle failure recorded while the factory ran wins.
     */
    void resolve(Object result, Dependencies recorded) {
        if (state != EntryState.RESOLVING) {
            return;
        }
        value = result;
        factory = null;
        dependencies = recorded;
        moveTo(EntryState.RESOLVED);
    }

    void fail(RuntimeException failure) {
        error = failure;
        value = null;
        dependencies = null;
        moveTo(EntryState.FAILED);
    }

    void accept() {
        moveTo(EntryState.RESOLVED);
    }

    /**
     * Turns an inherited value whose inputs changed back into its factory.
     */
    void invalidate() {
        factory = dependencies.factory();
        value = null;
        dependencies = null;
        moveTo(EntryState.PENDING_FACTORY);
    }

    void abort(Factory<?> original) {
        factory = original;
        moveTo(EntryState.PENDING_FACTORY);
    }

    private void ensureWritable() {
        if (state.isSettled()) {
            throw new AlreadyReadException(key);
        }
    }

    private void moveTo(EntryState next) {
        var previous = state;
        state = next;
        tracer.onTransition(key, previous, next);
    }
}
