package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A lambda of one parameter. Functions of several parameters are curried.
 */
public final class Function extends SExpr {
    private final VarDecl param;
    private final SExpr body;

    public Function(@NotNull VarDecl param, @NotNull SExpr body) {
        super(Opcode.FUNCTION);
        if (param.getKind() != VarDecl.Kind.FUN) {
            throw new IllegalArgumentException("function parameter must be a FUN declaration, got " + param.getKind());
        }
        this.param = param;
        this.body = Objects.requireNonNull(body);
    }

    public VarDecl getParam() {
        return param;
    }

    public SExpr getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "\\" + param.getName() + " -> " + operandString(body);
    }
}
