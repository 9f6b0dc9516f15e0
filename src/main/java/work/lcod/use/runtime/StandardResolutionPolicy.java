package work.lcod.use.runtime;

import java.lang.reflect.InvocationTargetException;
import work.lcod.use.api.Context;
import work.lcod.use.api.Key;
import work.lcod.use.api.NoConfigurationException;
import work.lcod.use.api.Recipe;

/**
 * Builds recipes and no-argument classes; anything else has no configuration.
 */
public final class StandardResolutionPolicy implements DefaultResolutionPolicy {
    public static final StandardResolutionPolicy INSTANCE = new StandardResolutionPolicy();

    private StandardResolutionPolicy() {}

    @Override
    public Object resolve(Context context, Object key) throws Exception {
        return switch (KeyKind.classify(key)) {
            case RECIPE -> ((Recipe<?>) key).create(context);
            case KEYED_RECIPE -> ((Key<?>) key).recipe().orElseThrow().create(context);
            case CONSTRUCTIBLE -> instantiate((Class<?>) key);
            case OPAQUE -> throw new NoConfigurationException(key);
        };
    }

    private static Object instantiate(Class<?> type) throws Exception {
        var constructor = KeyKind.noArgConstructor(type);
        try {
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (InvocationTargetException ex) {
            var cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    @Override
    public String toString() {
        return "standard";
    }
}
