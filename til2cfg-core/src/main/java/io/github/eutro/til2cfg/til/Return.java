package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

public final class Return extends Terminator {
    @Nullable
    private final SExpr value;

    public Return(@Nullable SExpr value) {
        super(Opcode.RETURN);
        this.value = value;
    }

    @Nullable
    public SExpr getValue() {
        return value;
    }

    @Override
    public List<BasicBlock> successors() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "return " + operandString(value);
    }
}
