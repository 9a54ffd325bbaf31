package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ssa.BasicBlock;

import java.util.List;

/**
 * The instruction ending a {@link BasicBlock}, which decides where control goes next.
 */
public abstract class Terminator extends Instruction {
    protected Terminator(Opcode opcode) {
        super(opcode);
    }

    /**
     * Get the blocks control may go to after this.
     *
     * @return The successor blocks, in order.
     */
    public abstract List<BasicBlock> successors();
}
