package work.lcod.use.runtime;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import work.lcod.use.api.Factory;

/**
 * Tracks which context is running a factory on the current thread and which keys that
 * factory has read. Frames are pushed for the synchronous extent of one call and always
 * popped on exit, so nested executions never leak into their callers.
 */
final class AmbientScope {
    private static final ThreadLocal<Frame> CURRENT = new ThreadLocal<>();

    private AmbientScope() {}

    static ScopedContext current() {
        var frame = CURRENT.get();
        return frame == null ? null : frame.context;
    }

    /**
     * Appends a key to the running factory's log when that factory belongs to
     * {@code context}. Reads on behalf of other contexts are not dependencies.
     */
    static void record(ScopedContext context, Object key) {
        var frame = CURRENT.get();
        if (frame != null && frame.context == context && frame.log != null) {
            frame.log.add(key);
        }
    }

    /**
     * Runs a factory with {@code context} installed and returns its result together
     * with the keys it read.
     */
    static <T> Outcome<T> execute(ScopedContext context, Factory<T> factory, Object key) throws Exception {
        var frame = new Frame(context, new LinkedHashSet<>());
        var previous = CURRENT.get();
        CURRENT.set(frame);
        try {
            T value = factory.create(context, key);
            return new Outcome<>(value, new ArrayList<>(frame.log));
        } finally {
            restore(previous);
        }
    }

    /**
     * Runs a task with {@code context} installed but without recording any reads.
     */
    static <T> T call(ScopedContext context, Supplier<T> task) {
        var previous = CURRENT.get();
        CURRENT.set(new Frame(context, null));
        try {
            return task.get();
        } finally {
            restore(previous);
        }
    }

    private static void restore(Frame previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }

    record Outcome<T>(T value, List<Object> keysRead) {}

    private static final class Frame {
        private final ScopedContext context;
        private final Set<Object> log;

        private Frame(ScopedContext context, Set<Object> log) {
            this.context = context;
            this.log = log;
        }
    }
}
