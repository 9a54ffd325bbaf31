package io.github.eutro.til2cfg.ssa;

import io.github.eutro.til2cfg.ext.CommonExts;
import io.github.eutro.til2cfg.ext.Ext;
import io.github.eutro.til2cfg.ext.TrackedList;
import io.github.eutro.til2cfg.til.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A basic block, with a list of {@link Phi} arguments, followed by a list of {@link Instruction instructions},
 * followed by exactly one {@link Terminator} at the end.
 * <p>
 * Every phi of the block has exactly one value slot for each predecessor.
 */
public final class BasicBlock extends SExpr {
    /**
     * A node in the dominator or post-dominator tree.
     * <p>
     * Once the owning {@link SCFG} is in normal form, the nodes of each subtree
     * have consecutive ids, starting at the id of the subtree's root.
     */
    public static final class TopologyNode {
        /**
         * The immediate (post-)dominator, or null for the root.
         */
        @Nullable
        public BasicBlock parent;
        public int sizeOfSubTree = 1;
        public int nodeID;

        /**
         * Check whether this node is an ancestor of, or the same as, another node of the same tree.
         *
         * @param other The other node.
         * @return Whether the other node is in the subtree of this one.
         */
        public boolean isParentOf(TopologyNode other) {
            int offset = other.nodeID - nodeID;
            return offset >= 0 && offset < sizeOfSubTree;
        }

        public void reset() {
            parent = null;
            sizeOfSubTree = 1;
            nodeID = 0;
        }
    }

    private final TrackedList<Phi> arguments = new TrackedList<Phi>() {
        @Override
        protected void claim(Phi elt) {
            elt.setBlock(BasicBlock.this);
            while (elt.values().size() < predecessors.size()) {
                elt.values().add(null);
            }
        }

        @Override
        protected void release(Phi elt) {
            elt.setBlock(null);
        }
    };
    private final TrackedList<Instruction> instructions = new TrackedList<Instruction>() {
        @Override
        protected void claim(Instruction elt) {
            elt.setBlock(BasicBlock.this);
        }

        @Override
        protected void release(Instruction elt) {
            elt.setBlock(null);
        }
    };
    private final ArrayList<BasicBlock> predecessors = new ArrayList<>();
    @Nullable
    private Terminator terminator;

    public final TopologyNode dominatorNode = new TopologyNode();
    public final TopologyNode postDominatorNode = new TopologyNode();
    private int blockID = -1;
    private int postBlockID = -1;

    public BasicBlock() {
        super(Opcode.BASIC_BLOCK);
    }

    /**
     * Create a block taking {@code nargs} arguments, each a fresh {@link Phi}.
     *
     * @param nargs The number of arguments.
     * @return The new block.
     */
    public static BasicBlock withArguments(int nargs) {
        BasicBlock bb = new BasicBlock();
        for (int i = 0; i < nargs; i++) {
            bb.addArgument(new Phi());
        }
        return bb;
    }

    public List<Phi> getArguments() {
        return arguments;
    }

    public void addArgument(Phi phi) {
        arguments.add(phi);
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public void addInstruction(Instruction insn) {
        instructions.add(insn);
    }

    public List<BasicBlock> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    /**
     * Add an incoming edge from {@code pred}, giving every phi of this block
     * a new, empty, value slot for it.
     *
     * @param pred The predecessor.
     * @return The index of the new edge, which is also the index of its slot in each phi.
     */
    public int addPredecessor(@NotNull BasicBlock pred) {
        int idx = predecessors.size();
        predecessors.add(Objects.requireNonNull(pred));
        for (Phi phi : arguments) {
            phi.values().add(null);
        }
        graphChanged();
        return idx;
    }

    /**
     * Make room for {@code n} predecessors, without adding any edges.
     *
     * @param n The expected number of predecessors.
     */
    public void reservePredecessors(int n) {
        predecessors.ensureCapacity(n);
        for (Phi phi : arguments) {
            phi.reserve(n);
        }
    }

    @Nullable
    public Terminator getTerminator() {
        return terminator;
    }

    public void setTerminator(@NotNull Terminator terminator) {
        if (this.terminator != null) {
            this.terminator.setBlock(null);
        }
        this.terminator = terminator;
        terminator.setBlock(this);
        graphChanged();
    }

    /**
     * Get the blocks control may go to from this one. Empty if there is no terminator yet.
     *
     * @return The successors.
     */
    public List<BasicBlock> successors() {
        return terminator == null ? Collections.emptyList() : terminator.successors();
    }

    /**
     * Get the position of this block in the topological order of its CFG, or -1 if not yet sorted.
     *
     * @return The block id.
     */
    public int getBlockID() {
        return blockID;
    }

    public void setBlockID(int blockID) {
        this.blockID = blockID;
    }

    /**
     * Get the position of this block in the post-topological order of its CFG, or -1 if not yet sorted.
     *
     * @return The post block id.
     */
    public int getPostBlockID() {
        return postBlockID;
    }

    public void setPostBlockID(int postBlockID) {
        this.postBlockID = postBlockID;
    }

    /**
     * Give the arguments, instructions and terminator of this block sequential ids.
     *
     * @param id The first id to give out.
     * @return The next free id.
     */
    public int renumber(int id) {
        for (Phi arg : arguments) {
            arg.setInstrID(id++);
        }
        for (Instruction insn : instructions) {
            insn.setInstrID(id++);
        }
        if (terminator != null) {
            terminator.setInstrID(id++);
        }
        return id;
    }

    /**
     * Check whether every path from the entry to {@code other} passes through this block.
     * A block dominates itself.
     * <p>
     * Only meaningful while the owning CFG is in normal form.
     *
     * @param other The other block.
     * @return Whether this block dominates it.
     */
    public boolean dominates(BasicBlock other) {
        return dominatorNode.isParentOf(other.dominatorNode);
    }

    /**
     * Check whether every path from {@code other} to the exit passes through this block.
     * A block post-dominates itself.
     *
     * @param other The other block.
     * @return Whether this block post-dominates it.
     */
    public boolean postDominates(BasicBlock other) {
        return postDominatorNode.isParentOf(other.postDominatorNode);
    }

    @Nullable
    public BasicBlock getIDom() {
        return dominatorNode.parent;
    }

    @Nullable
    public BasicBlock getIPostDom() {
        return postDominatorNode.parent;
    }

    private void graphChanged() {
        if (owner != null) {
            owner.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        }
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        if (blockID < 0) {
            return String.format("@%08x", System.identityHashCode(this));
        }
        return "BB_" + blockID;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append('(');
        boolean first = true;
        for (Phi arg : arguments) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(arg.toRefString());
        }
        sb.append(")\n{\n");
        for (Phi arg : arguments) {
            sb.append(' ').append(arg.toRefString()).append(" = ").append(arg).append('\n');
        }
        for (Instruction insn : instructions) {
            sb.append(' ').append(insn.toRefString()).append(" = ").append(insn).append('\n');
        }
        sb.append(' ').append(terminator);
        sb.append("\n}");
        return sb.toString();
    }

    // exts
    private SCFG owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_CFG) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_CFG) {
            owner = (SCFG) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_CFG) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
