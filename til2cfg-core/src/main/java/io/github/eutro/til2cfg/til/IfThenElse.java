package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class IfThenElse extends SExpr {
    private final SExpr condition;
    private final SExpr thenExpr;
    private final SExpr elseExpr;

    public IfThenElse(@NotNull SExpr condition, @NotNull SExpr thenExpr, @NotNull SExpr elseExpr) {
        super(Opcode.IF_THEN_ELSE);
        this.condition = Objects.requireNonNull(condition);
        this.thenExpr = Objects.requireNonNull(thenExpr);
        this.elseExpr = Objects.requireNonNull(elseExpr);
    }

    public SExpr getCondition() {
        return condition;
    }

    public SExpr getThenExpr() {
        return thenExpr;
    }

    public SExpr getElseExpr() {
        return elseExpr;
    }

    @Override
    public String toString() {
        return "if " + operandString(condition)
                + " then " + operandString(thenExpr)
                + " else " + operandString(elseExpr);
    }
}
