package work.lcod.use.api;

import work.lcod.use.runtime.RootContext;

/**
 * Entry point: the process-wide global context and shorthands for reaching the
 * context that is currently running a factory.
 *
 * <pre>
 * var app = Use.global().fork().setValue(PORT, 8080);
 * app.define(Server.class, (ctx, key) -&gt; new Server(Use.get(PORT)));
 * Server server = app.invoke(Server.class);
 * </pre>
 */
public final class Use {
    private static final GlobalContext GLOBAL = RootContext.create(ContextConfiguration.defaults());

    private Use() {}

    public static GlobalContext global() {
        return GLOBAL;
    }

    /**
     * Creates an independent root, with its own defaults and settings. All roots share
     * the thread's active context: {@link GlobalContext#current()} and lookups through
     * any root answer with whichever context is running a factory, whatever its tree.
     */
    public static GlobalContext newRoot(ContextConfiguration configuration) {
        return RootContext.create(configuration);
    }

    public static Context current() {
        return GLOBAL.current();
    }

    public static Object get(Object key) {
        return GLOBAL.invoke(key);
    }

    public static <T> T get(Class<T> key) {
        return GLOBAL.invoke(key);
    }

    public static <T> T get(Key<T> key) {
        return GLOBAL.invoke(key);
    }

    public static <T> T get(Recipe<T> key) {
        return GLOBAL.invoke(key);
    }
}
