package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Calls a fully applied function.
 */
public final class Call extends Instruction {
    private final SExpr target;

    public Call(@NotNull SExpr target) {
        super(Opcode.CALL);
        this.target = Objects.requireNonNull(target);
    }

    public SExpr getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return "call " + operandString(target);
    }
}
