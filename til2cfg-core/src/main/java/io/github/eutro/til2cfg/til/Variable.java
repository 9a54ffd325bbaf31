package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A reference to a resolved declaration which has no definition to substitute, such as a function parameter.
 */
public final class Variable extends Instruction {
    private final VarDecl decl;

    public Variable(@NotNull VarDecl decl) {
        super(Opcode.VARIABLE);
        this.decl = Objects.requireNonNull(decl);
    }

    public VarDecl getDecl() {
        return decl;
    }

    @Override
    public String toString() {
        return decl.getName();
    }
}
