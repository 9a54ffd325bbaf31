package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Binds a name to a value in a body. The name is not in scope in its own definition.
 */
public final class Let extends SExpr {
    private final VarDecl decl;
    private final SExpr body;

    public Let(@NotNull VarDecl decl, @NotNull SExpr body) {
        super(Opcode.LET);
        if (decl.getKind() != VarDecl.Kind.LET) {
            throw new IllegalArgumentException("let binds LET declarations, got " + decl.getKind());
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
        return "let " + decl.getName() + " = " + operandString(decl.getDefinition()) + "; " + operandString(body);
    }
}
