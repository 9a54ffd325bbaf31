package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A conditional jump to one of two blocks, neither of which takes arguments.
 */
public final class Branch extends Terminator {
    private final SExpr condition;
    private final BasicBlock thenBlock;
    private final BasicBlock elseBlock;

    public Branch(@NotNull SExpr condition, @NotNull BasicBlock thenBlock, @NotNull BasicBlock elseBlock) {
        super(Opcode.BRANCH);
        this.condition = Objects.requireNonNull(condition);
        this.thenBlock = Objects.requireNonNull(thenBlock);
        this.elseBlock = Objects.requireNonNull(elseBlock);
    }

    public SExpr getCondition() {
        return condition;
    }

    public BasicBlock getThenBlock() {
        return thenBlock;
    }

    public BasicBlock getElseBlock() {
        return elseBlock;
    }

    @Override
    public List<BasicBlock> successors() {
        return Arrays.asList(thenBlock, elseBlock);
    }

    @Override
    public String toString() {
        return "branch " + operandString(condition)
                + " ? " + thenBlock.toTargetString()
                + " : " + elseBlock.toTargetString();
    }
}
