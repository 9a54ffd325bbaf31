package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class BinaryOp extends Instruction {
    public enum Kind {
        MUL("*"),
        DIV("/"),
        REM("%"),
        ADD("+"),
        SUB("-"),
        SHL("<<"),
        SHR(">>"),
        BIT_AND("&"),
        BIT_XOR("^"),
        BIT_OR("|"),
        EQ("=="),
        NEQ("!="),
        LT("<"),
        LEQ("<="),
        LOGIC_AND("&&"),
        LOGIC_OR("||");

        public final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }
    }

    private final Kind kind;
    private final SExpr lhs;
    private final SExpr rhs;

    public BinaryOp(@NotNull Kind kind, @NotNull SExpr lhs, @NotNull SExpr rhs) {
        super(Opcode.BINARY_OP);
        this.kind = Objects.requireNonNull(kind);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    public Kind getKind() {
        return kind;
    }

    public SExpr getLhs() {
        return lhs;
    }

    public SExpr getRhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return operandString(lhs) + " " + kind.symbol + " " + operandString(rhs);
    }
}
