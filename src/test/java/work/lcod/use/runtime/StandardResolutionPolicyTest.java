package work.lcod.use.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.AbstractList;
import java.util.ArrayList;
import org.junit.jupiter.api.Test;
import work.lcod.use.api.Context;
import work.lcod.use.api.Key;
import work.lcod.use.api.NoConfigurationException;
import work.lcod.use.api.Recipe;

class StandardResolutionPolicyTest {
    private final StandardResolutionPolicy policy = StandardResolutionPolicy.INSTANCE;

    @Test
    void classifiesKeys() {
        Recipe<String> recipe = ctx -> "r";
        assertEquals(KeyKind.RECIPE, KeyKind.classify(recipe));
        assertEquals(KeyKind.KEYED_RECIPE, KeyKind.classify(Key.withRecipe("k", ctx -> 1)));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify(Key.named("k")));
        assertEquals(KeyKind.CONSTRUCTIBLE, KeyKind.classify(ArrayList.class));
        assertEquals(KeyKind.CONSTRUCTIBLE, KeyKind.classify(Plain.class));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify(AbstractList.class));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify(Runnable.class));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify(NeedsArgument.class));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify(Inner.class));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify(KeyKind.class));
        assertEquals(KeyKind.OPAQUE, KeyKind.classify("text"));
    }

    @Test
    void buildsRecipesAndClasses() throws Exception {
        Context context = null;
        Recipe<String> recipe = ctx -> "r";
        assertEquals("r", policy.resolve(context, recipe));
        assertEquals(1, policy.resolve(context, Key.withRecipe("k", ctx -> 1)));
        assertInstanceOf(Plain.class, policy.resolve(context, Plain.class));
    }

    @Test
    void constructorFailuresSurfaceTheirCause() {
        assertThrows(IOException.class, () -> policy.resolve(null, Failing.class));
    }

    @Test
    void opaqueKeysHaveNoConfiguration() {
        var thrown = assertThrows(NoConfigurationException.class, () -> policy.resolve(null, "text"));
        assertEquals("No config for text", thrown.getMessage());
    }

    static final class Plain {}

    static final class NeedsArgument {
        NeedsArgument(String value) {}
    }

    static final class Failing {
        Failing() throws IOException {
            throw new IOException("no");
        }
    }

    final class Inner {}
}
