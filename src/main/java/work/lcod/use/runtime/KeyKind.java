package work.lcod.use.runtime;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import work.lcod.use.api.Key;
import work.lcod.use.api.Recipe;

/**
 * How the default policy can produce a value for a key nobody configured.
 */
public enum KeyKind {
    /** The key implements {@link Recipe} and builds itself. */
    RECIPE,
    /** A {@link Key} that carries a recipe. */
    KEYED_RECIPE,
    /** A concrete class with a no-argument constructor. */
    CONSTRUCTIBLE,
    /** Nothing to go on. */
    OPAQUE;

    public static KeyKind classify(Object key) {
        if (key instanceof Recipe<?>) {
            return RECIPE;
        }
        if (key instanceof Key<?> typed) {
            return typed.recipe().isPresent() ? KEYED_RECIPE : OPAQUE;
        }
        if (key instanceof Class<?> type) {
            return noArgConstructor(type) != null ? CONSTRUCTIBLE : OPAQUE;
        }
        return OPAQUE;
    }

    static Constructor<?> noArgConstructor(Class<?> type) {
        int modifiers = type.getModifiers();
        if (type.isInterface() || type.isArray() || type.isPrimitive() || type.isEnum()
            || Modifier.isAbstract(modifiers)) {
            return null;
        }
        if (type.getEnclosingClass() != null && !Modifier.isStatic(modifiers)) {
            return null;
        }
        try {
            return type.getDeclaredConstructor();
        } catch (NoSuchMethodException ex) {
            return null;
        }
    }
}
