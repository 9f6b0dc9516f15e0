package work.lcod.use.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GlobalContextTest {
    private static final Key<Integer> A_NUMBER = Key.named("aNumber");
    private static final Key<Object> SOMETHING = Key.named("something");

    @Test
    void lookupOutsideFactoryFails() {
        var thrown = assertThrows(NoActiveContextException.class, () -> Use.get(A_NUMBER));
        assertEquals("No current context", thrown.getMessage());
    }

    @Test
    void currentOutsideFactoryFails() {
        assertThrows(NoActiveContextException.class, Use::current);
        assertThrows(NoActiveContextException.class, () -> Use.global().current());
    }

    @Test
    void currentIsTheResolvingContext() {
        var ctx = Use.global().fork();
        ctx.define(SOMETHING, (c, key) -> Use.global().current());
        assertSame(ctx, ctx.invoke(SOMETHING));
    }

    @Test
    void defaultFactoryTokenIsRecipe() {
        assertSame(Recipe.class, Use.global().defaultFactoryToken());
    }

    @Test
    void ambientContextRestoredAfterFailure() {
        var ctx = Use.global().fork();
        ctx.define(SOMETHING, (c, key) -> {
            throw new IllegalStateException("nope");
        });
        assertThrows(IllegalStateException.class, () -> ctx.invoke(SOMETHING));
        assertThrows(NoActiveContextException.class, Use::current);
    }

    @Test
    void nestedContextsRestoreTheOuterOne() {
        var outer = Use.global().fork();
        var inner = Use.global().fork();
        inner.define(SOMETHING, (c, key) -> Use.current());
        outer.define(SOMETHING, (c, key) -> {
            var seen = inner.invoke(SOMETHING);
            return List.of(seen, Use.current());
        });
        assertEquals(List.of(inner, outer), outer.invoke(SOMETHING));
    }

    @Test
    void rootsShareTheActiveContext() {
        var other = Use.newRoot(ContextConfiguration.defaults());
        var ctx = other.fork();
        ctx.define(SOMETHING, (c, key) -> List.of(Use.current(), other.current()));
        assertEquals(List.of(ctx, ctx), ctx.invoke(SOMETHING));
    }

    @Test
    void rootDefaultsReachEveryFork() {
        var root = Use.newRoot(ContextConfiguration.defaults());
        root.setValue(A_NUMBER, 7).define(SOMETHING, (c, key) -> c);
        var first = root.fork();
        var second = root.fork();
        assertEquals(7, first.invoke(A_NUMBER));
        assertSame(first, first.invoke(SOMETHING));
        assertSame(second, second.invoke(SOMETHING));
    }

    @Test
    void rootForkWithKey() {
        var root = Use.newRoot(ContextConfiguration.defaults()).setValue(A_NUMBER, 3);
        assertEquals(3, root.fork(A_NUMBER));
    }

    @Test
    void independentRootsDoNotShareDefaults() {
        var one = Use.newRoot(ContextConfiguration.defaults()).setValue(A_NUMBER, 1);
        var two = Use.newRoot(ContextConfiguration.defaults());
        assertEquals(1, one.fork().invoke(A_NUMBER));
        assertThrows(NoConfigurationException.class, () -> two.fork().invoke(A_NUMBER));
    }

    @Test
    void customPolicyHandlesUnconfiguredKeys() {
        var root = Use.newRoot(ContextConfiguration.builder()
            .policy((ctx, key) -> "default:" + key)
            .build());
        var ctx = root.fork();
        assertEquals("default:x", ctx.invoke("x"));
        assertSame(ctx.invoke("x"), ctx.fork().invoke("x"));
    }

    @Test
    void tracerSeesTransitions() {
        List<String> events = new ArrayList<>();
        var root = Use.newRoot(ContextConfiguration.builder()
            .tracer((key, from, to) -> events.add(key + " " + from + " -> " + to))
            .build());
        var ctx = root.fork().setValue(A_NUMBER, 1);
        ctx.invoke(A_NUMBER);
        assertEquals(List.of(
            "Key(aNumber) EMPTY -> PENDING_VALUE",
            "Key(aNumber) PENDING_VALUE -> RESOLVED"
        ), events);
    }
}
