package io.github.eutro.til2cfg.passes.meta;

import io.github.eutro.til2cfg.diag.ReducerException;
import io.github.eutro.til2cfg.ext.MetadataState;
import io.github.eutro.til2cfg.passes.CFGPass;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.util.Logging;
import org.apache.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/**
 * Brings an {@link SCFG} into normal form:
 * <ol>
 *     <li>sort the blocks post-topologically from the exit,</li>
 *     <li>compute post-dominators in that order,</li>
 *     <li>sort the blocks topologically from the entry, and renumber,</li>
 *     <li>compute dominators, and number both trees for constant-time dominance queries.</li>
 * </ol>
 * Every block must be reachable from the entry and reach the exit, or a {@link ReducerException} is thrown.
 */
public class ComputeNormalForm implements CFGPass {
    public static final ComputeNormalForm INSTANCE = new ComputeNormalForm();

    private static final Logger LOGGER = Logging.getLogger();

    @Override
    public void runOn(SCFG cfg) {
        List<BasicBlock> blocks = cfg.getBlocks();
        int n = blocks.size();

        BasicBlock[] postOrder = new BasicBlock[n];
        int unreachable = SortBlocks.postTopological(cfg, postOrder);
        if (unreachable != 0) {
            throw ReducerException.unreachableBlocks(unreachable, "exit");
        }
        List<BasicBlock> postOrderList = Arrays.asList(postOrder);
        ComputeDoms.computePostDominators(postOrderList);

        BasicBlock[] order = new BasicBlock[n];
        unreachable = SortBlocks.topological(cfg, order);
        if (unreachable != 0) {
            throw ReducerException.unreachableBlocks(unreachable, "entry");
        }
        blocks.clear();
        blocks.addAll(Arrays.asList(order));
        cfg.renumber();

        ComputeDoms.computeDominators(blocks);
        ComputeDoms.numberTree(blocks, b -> b.dominatorNode);
        ComputeDoms.numberTree(postOrderList, b -> b.postDominatorNode);

        cfg.getMetadata().validate(MetadataState.NORMAL_FORM);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("normalized CFG: " + n + " blocks, " + cfg.getNumInstructions() + " instruction ids");
        }
    }
}
