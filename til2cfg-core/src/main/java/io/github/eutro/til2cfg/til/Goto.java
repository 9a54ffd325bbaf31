package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An unconditional jump. The values passed to the target are stored in
 * the target's phis, at the index of this edge.
 */
public final class Goto extends Terminator {
    private final BasicBlock target;
    private final int index;

    public Goto(@NotNull BasicBlock target, int index) {
        super(Opcode.GOTO);
        this.target = Objects.requireNonNull(target);
        this.index = index;
    }

    public BasicBlock getTarget() {
        return target;
    }

    /**
     * Get the index of this edge among the target's predecessors.
     *
     * @return The edge index.
     */
    public int getIndex() {
        return index;
    }

    @Override
    public List<BasicBlock> successors() {
        return Collections.singletonList(target);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("goto ").append(target.toTargetString()).append('(');
        boolean first = true;
        for (Phi phi : target.getArguments()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(index < phi.values().size() ? operandString(phi.values().get(index)) : "?");
        }
        return sb.append(')').toString();
    }
}
