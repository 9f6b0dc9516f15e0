package work.lcod.use.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Named lookup key compared by identity. Two keys with the same name are distinct.
 *
 * <p>A key may carry a {@link Recipe} used when no context defines a factory for it,
 * which is how types that cannot be built without arguments supply their own default.
 */
public final class Key<T> {
    private final String name;
    private final Recipe<? extends T> recipe;

    private Key(String name, Recipe<? extends T> recipe) {
        this.name = Objects.requireNonNull(name, "name");
        this.recipe = recipe;
    }

    public static <T> Key<T> named(String name) {
        return new Key<>(name, null);
    }

    public static <T> Key<T> withRecipe(String name, Recipe<? extends T> recipe) {
        return new Key<>(name, Objects.requireNonNull(recipe, "recipe"));
    }

    public String name() {
        return name;
    }

    public Optional<Recipe<? extends T>> recipe() {
        return Optional.ofNullable(recipe);
    }

    @Override
    public String toString() {
        return "Key(" + name + ")";
    }
}
