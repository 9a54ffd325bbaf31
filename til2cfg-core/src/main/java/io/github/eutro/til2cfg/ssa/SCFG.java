package io.github.eutro.til2cfg.ssa;

import io.github.eutro.til2cfg.ext.CommonExts;
import io.github.eutro.til2cfg.ext.Ext;
import io.github.eutro.til2cfg.ext.MetadataState;
import io.github.eutro.til2cfg.ext.TrackedList;
import io.github.eutro.til2cfg.til.Opcode;
import io.github.eutro.til2cfg.til.Phi;
import io.github.eutro.til2cfg.til.Return;
import io.github.eutro.til2cfg.til.SExpr;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A structured control-flow graph: the lowered body of one function.
 * <p>
 * Control starts at the {@link #getEntry() entry}, which takes no arguments, and leaves through the
 * {@link #getExit() exit}, which takes the result as its single argument and returns it.
 * <p>
 * After {@link #computeNormalForm()}, {@link #getBlocks()} is in topological order, each block's
 * {@link BasicBlock#getBlockID() id} is its index, and the dominator trees are available.
 */
public final class SCFG extends SExpr {
    private final TrackedList<BasicBlock> blocks = new TrackedList<BasicBlock>() {
        @Override
        protected void claim(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_CFG, SCFG.this);
        }

        @Override
        protected void release(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_CFG);
        }
    };
    private final BasicBlock entry;
    private final BasicBlock exit;
    private int numInstructions;

    public SCFG() {
        super(Opcode.SCFG);
        entry = new BasicBlock();
        exit = new BasicBlock();
        Phi result = new Phi();
        exit.addArgument(result);
        exit.setTerminator(new Return(result));
        add(entry);
        add(exit);
    }

    /**
     * Get the blocks of this CFG.
     * <p>
     * Reordering the list directly does not invalidate the normal form, adding through {@link #add(BasicBlock)} does.
     *
     * @return The blocks.
     */
    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    /**
     * Add a block to this CFG.
     *
     * @param bb The block, which must not belong to any CFG yet.
     */
    public void add(BasicBlock bb) {
        SCFG owner = bb.getNullable(CommonExts.OWNING_CFG);
        if (owner != null) {
            throw new IllegalStateException("block " + bb.toTargetString() + " already belongs to a CFG");
        }
        blocks.add(bb);
        metadata.graphChanged();
    }

    /**
     * Create a block taking {@code nargs} arguments and add it to this CFG.
     *
     * @param nargs The number of arguments.
     * @return The block.
     */
    public BasicBlock newBlock(int nargs) {
        BasicBlock bb = BasicBlock.withArguments(nargs);
        add(bb);
        return bb;
    }

    public BasicBlock getEntry() {
        return entry;
    }

    public BasicBlock getExit() {
        return exit;
    }

    /**
     * Give every block its index as id, and every instruction a unique id, starting at 1.
     */
    public void renumber() {
        int instrID = 1; // 0 is unnumbered
        int blockID = 0;
        for (BasicBlock block : blocks) {
            instrID = block.renumber(instrID);
            block.setBlockID(blockID++);
        }
        numInstructions = instrID;
    }

    /**
     * Get one more than the greatest instruction id given out by the last {@link #renumber()}.
     *
     * @return The instruction count.
     */
    public int getNumInstructions() {
        return numInstructions;
    }

    public MetadataState getMetadata() {
        return metadata;
    }

    /**
     * Sort, number, and compute the dominator and post-dominator trees of this CFG, if it is not already in normal form.
     */
    public void computeNormalForm() {
        metadata.ensureValid(this, MetadataState.NORMAL_FORM);
    }

    public boolean isNormal() {
        return metadata.isValid(MetadataState.NORMAL_FORM);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("scfg ");
        sb.append(entry.toTargetString()).append(" -> ").append(exit.toTargetString()).append("\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.toString();
    }

    // exts
    private final MetadataState metadata = new MetadataState();

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metadata;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException();
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException();
        }
        super.removeExt(ext);
    }
}
