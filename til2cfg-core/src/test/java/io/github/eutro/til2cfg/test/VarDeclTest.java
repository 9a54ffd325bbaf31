package io.github.eutro.til2cfg.test;

import io.github.eutro.til2cfg.til.VarDecl;
import org.junit.jupiter.api.Test;

import static io.github.eutro.til2cfg.test.Trees.lit;
import static org.junit.jupiter.api.Assertions.*;

public class VarDeclTest {
    @Test
    void letrecDefinitionIsSetOnce() {
        VarDecl f = new VarDecl("f", VarDecl.Kind.LETREC, null);
        assertNull(f.getDefinition());
        f.setDefinition(lit(1));
        assertEquals(1, Trees.literalValue(f.getDefinition()));
        assertThrows(IllegalStateException.class, () -> f.setDefinition(lit(2)));
    }

    @Test
    void otherDefinitionsAreFixed() {
        VarDecl x = new VarDecl("x", VarDecl.Kind.LET, lit(1));
        assertThrows(IllegalStateException.class, () -> x.setDefinition(lit(2)));
        VarDecl p = new VarDecl("p", VarDecl.Kind.FUN, null);
        assertThrows(IllegalStateException.class, () -> p.setDefinition(lit(2)));
    }
}
