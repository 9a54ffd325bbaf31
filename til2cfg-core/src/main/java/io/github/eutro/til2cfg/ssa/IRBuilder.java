package io.github.eutro.til2cfg.ssa;

import io.github.eutro.til2cfg.diag.ReducerException;
import io.github.eutro.til2cfg.ext.CommonExts;
import io.github.eutro.til2cfg.til.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * An IR, or instruction, builder, which encapsulates a position in a CFG
 * where instructions are being inserted.
 * <p>
 * Instructions are buffered until the block is {@link #finish(Terminator) finished},
 * and only then become the block's instructions.
 */
public class IRBuilder {
    /**
     * The CFG being inserted into.
     */
    public final SCFG cfg;
    @Nullable
    private BasicBlock bb;
    private final List<Instruction> pending = new ArrayList<>();

    /**
     * Construct an instruction builder with no open block.
     *
     * @param cfg The CFG.
     */
    public IRBuilder(SCFG cfg) {
        this.cfg = cfg;
    }

    /**
     * Get the block currently being built, if any.
     *
     * @return The block, or null.
     */
    @Nullable
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Start inserting into a block, adding it to the CFG if it isn't part of it yet.
     *
     * @param bb The block.
     */
    public void startBlock(@NotNull BasicBlock bb) {
        if (this.bb != null) {
            throw new IllegalStateException("haven't finished current block " + this.bb.toTargetString());
        }
        if (!bb.getInstructions().isEmpty() || bb.getTerminator() != null) {
            throw new IllegalStateException("block " + bb.toTargetString() + " was already built");
        }
        SCFG owner = bb.getNullable(CommonExts.OWNING_CFG);
        if (owner == null) {
            cfg.add(bb);
        } else if (owner != cfg) {
            throw new IllegalStateException("block " + bb.toTargetString() + " belongs to another CFG");
        }
        this.bb = bb;
    }

    /**
     * Insert an expression into the current block, if it needs to be.
     * <p>
     * Inlineable nodes, non-instructions, and instructions already placed in some block are skipped.
     *
     * @param e The expression.
     */
    public void insert(@Nullable SExpr e) {
        if (e == null || e.opcode().isInlineable() || !(e instanceof Instruction)) {
            return;
        }
        if (e instanceof Terminator) {
            throw new IllegalArgumentException("terminators end blocks, they are not inserted: " + e);
        }
        Instruction insn = (Instruction) e;
        if (insn.getBlock() == null) {
            insn.setBlock(requireOpen());
            pending.add(insn);
        }
    }

    /**
     * End the current block with a branch to two new blocks.
     *
     * @param cond The branch condition.
     * @return The branch, whose then and else blocks have the current block as their only predecessor.
     */
    public Branch branch(@NotNull SExpr cond) {
        BasicBlock current = requireOpen();
        BasicBlock thenBlock = new BasicBlock();
        thenBlock.addPredecessor(current);
        BasicBlock elseBlock = new BasicBlock();
        elseBlock.addPredecessor(current);
        Branch br = new Branch(cond, thenBlock, elseBlock);
        finish(br);
        return br;
    }

    /**
     * End the current block with a jump to a block taking exactly one argument.
     *
     * @param target The target block.
     * @param value  The value to pass.
     * @return The jump.
     */
    public Goto jump(@NotNull BasicBlock target, @Nullable SExpr value) {
        BasicBlock current = requireOpen();
        if (target.getArguments().size() != 1) {
            throw ReducerException.arityMismatch(target, target.getArguments().size(), 1);
        }
        int idx = target.addPredecessor(current);
        target.getArguments().get(0).values().set(idx, value);
        Goto jump = new Goto(target, idx);
        finish(jump);
        return jump;
    }

    /**
     * End the current block with a jump, passing one value for each argument of the target.
     *
     * @param target The target block.
     * @param args   The values to pass, in argument order.
     * @return The jump.
     */
    public Goto jump(@NotNull BasicBlock target, @NotNull List<? extends SExpr> args) {
        BasicBlock current = requireOpen();
        List<Phi> params = target.getArguments();
        if (params.size() != args.size()) {
            throw ReducerException.arityMismatch(target, params.size(), args.size());
        }
        int idx = target.addPredecessor(current);
        for (int i = 0; i < args.size(); i++) {
            params.get(i).values().set(idx, args.get(i));
        }
        Goto jump = new Goto(target, idx);
        finish(jump);
        return jump;
    }

    /**
     * Move the buffered instructions into the current block, end it with {@code terminator}, and close it.
     *
     * @param terminator The terminator.
     */
    public void finish(@NotNull Terminator terminator) {
        BasicBlock current = requireOpen();
        if (!current.getInstructions().isEmpty()) {
            throw new IllegalStateException("block " + current.toTargetString() + " was already built");
        }
        for (Instruction insn : pending) {
            current.addInstruction(insn);
        }
        current.setTerminator(terminator);
        pending.clear();
        bb = null;
    }

    private BasicBlock requireOpen() {
        if (bb == null) {
            throw new IllegalStateException("no block is being built");
        }
        return bb;
    }
}
