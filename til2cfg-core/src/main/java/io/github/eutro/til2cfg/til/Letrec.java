package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Binds a name to a value in a body, with the name also in scope in its own definition.
 * This is how local functions refer to themselves.
 */
public final class Letrec extends SExpr {
    private final VarDecl decl;
    private final SExpr body;

    public Letrec(@NotNull VarDecl decl, @NotNull SExpr body) {
        super(Opcode.LETREC);
        if (decl.getKind() != VarDecl.Kind.LETREC) {
            throw new IllegalArgumentException("letrec binds LETREC declarations, got " + decl.getKind());
        }
        this.decl = decl;
        this.body = Objects.requireNonNull(body);
    }

    public VarDecl getDecl() {
        return decl;
    }

    public SExpr getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "letrec " + decl.getName() + " = " + operandString(decl.getDefinition()) + "; " + operandString(body);
    }
}
