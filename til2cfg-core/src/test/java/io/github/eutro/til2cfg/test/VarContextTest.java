package io.github.eutro.til2cfg.test;

import io.github.eutro.til2cfg.passes.convert.VarContext;
import io.github.eutro.til2cfg.til.VarDecl;
import org.junit.jupiter.api.Test;

import static io.github.eutro.til2cfg.test.Trees.lit;
import static org.junit.jupiter.api.Assertions.*;

public class VarContextTest {
    private static VarDecl let(String name, Object value) {
        return new VarDecl(name, VarDecl.Kind.LET, lit(value));
    }

    @Test
    void innermostBindingWins() {
        VarContext ctx = new VarContext();
        VarDecl outer = let("x", 1);
        VarDecl inner = let("x", 2);
        ctx.push(outer);
        ctx.push(let("y", 3));
        ctx.push(inner);
        assertSame(inner, ctx.lookup("x").orElse(null));
        assertFalse(ctx.lookup("z").isPresent());

        ctx.pop(inner);
        assertSame(outer, ctx.lookup("x").orElse(null));
    }

    @Test
    void popChecksTheName() {
        VarContext ctx = new VarContext();
        ctx.push(let("x", 1));
        assertThrows(IllegalStateException.class, () -> ctx.pop(let("y", 1)));
        ctx.pop(let("x", 2));
        assertThrows(IllegalStateException.class, () -> ctx.pop(let("x", 1)));
    }

    @Test
    void indicesCountFromTheTop() {
        VarContext ctx = new VarContext();
        VarDecl a = let("a", 1);
        VarDecl b = let("b", 2);
        ctx.push(a);
        ctx.push(b);
        assertEquals(2, ctx.size());
        assertSame(b, ctx.get(0));
        assertSame(a, ctx.get(1));
        VarDecl c = let("c", 3);
        ctx.set(1, c);
        assertSame(c, ctx.lookup("c").orElse(null));
        assertFalse(ctx.lookup("a").isPresent());
    }

    @Test
    void clonesAreIndependent() {
        VarContext ctx = new VarContext();
        VarDecl a = let("a", 1);
        ctx.push(a);
        VarContext copy = ctx.clone();
        copy.push(let("b", 2));
        copy.set(1, let("a", 3));

        assertEquals(1, ctx.size());
        assertSame(a, ctx.get(0));
        assertFalse(ctx.lookup("b").isPresent());
        assertEquals(2, copy.size());
    }
}
