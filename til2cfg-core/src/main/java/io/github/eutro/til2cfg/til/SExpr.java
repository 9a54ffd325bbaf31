package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the expression tree.
 * <p>
 * Nodes are immutable once constructed, except for the bookkeeping
 * of {@link Instruction}s and the graph structure of blocks.
 */
public abstract class SExpr extends ExtHolder {
    private final Opcode opcode;

    protected SExpr(Opcode opcode) {
        this.opcode = opcode;
    }

    public final Opcode opcode() {
        return opcode;
    }

    /**
     * Render an operand of another node: instructions already placed in a block
     * are printed as references, everything else inline.
     *
     * @param e The operand.
     * @return The rendered operand.
     */
    public static String operandString(@Nullable SExpr e) {
        if (e == null) return "_";
        if (e instanceof Instruction && ((Instruction) e).getBlock() != null) {
            return ((Instruction) e).toRefString();
        }
        return e.toString();
    }
}
