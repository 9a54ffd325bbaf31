package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class UnaryOp extends Instruction {
    public enum Kind {
        MINUS("-"),
        BIT_NOT("~"),
        LOGIC_NOT("!");

        public final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }
    }

    private final Kind kind;
    private final SExpr operand;

    public UnaryOp(@NotNull Kind kind, @NotNull SExpr operand) {
        super(Opcode.UNARY_OP);
        this.kind = Objects.requireNonNull(kind);
        this.operand = Objects.requireNonNull(operand);
    }

    public Kind getKind() {
        return kind;
    }

    public SExpr getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return kind.symbol + operandString(operand);
    }
}
