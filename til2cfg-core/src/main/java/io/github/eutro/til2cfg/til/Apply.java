package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Application of a function to one argument, without calling it yet.
 */
public final class Apply extends Instruction {
    private final SExpr fn;
    private final SExpr arg;

    public Apply(@NotNull SExpr fn, @NotNull SExpr arg) {
        super(Opcode.APPLY);
        this.fn = Objects.requireNonNull(fn);
        this.arg = Objects.requireNonNull(arg);
    }

    public SExpr getFn() {
        return fn;
    }

    public SExpr getArg() {
        return arg;
    }

    @Override
    public String toString() {
        return operandString(fn) + "(" + operandString(arg) + ")";
    }
}
