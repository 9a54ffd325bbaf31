package io.github.eutro.til2cfg.passes.meta;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.BasicBlock.TopologyNode;
import io.github.eutro.til2cfg.util.F;

import java.util.List;

/*
 Immediate dominators by walking up the partial tree from each forward predecessor,
 in a single sweep over a topological order, as in
 Keith D. Cooper, Timothy J. Harvey and Ken Kennedy. A simple, fast dominance algorithm. 2001.
*/
public final class ComputeDoms {
    private ComputeDoms() {
    }

    /**
     * Compute the immediate post-dominator of every block.
     *
     * @param postOrder The blocks, sorted by {@link SortBlocks#postTopological}.
     */
    public static void computePostDominators(List<BasicBlock> postOrder) {
        for (BasicBlock bb : postOrder) {
            computeImmediate(bb,
                    bb.successors(),
                    BasicBlock::getPostBlockID,
                    b -> b.postDominatorNode);
        }
    }

    /**
     * Compute the immediate dominator of every block.
     *
     * @param order The blocks, sorted by {@link SortBlocks#topological}.
     */
    public static void computeDominators(List<BasicBlock> order) {
        for (BasicBlock bb : order) {
            computeImmediate(bb,
                    bb.getPredecessors(),
                    BasicBlock::getBlockID,
                    b -> b.dominatorNode);
        }
    }

    private static void computeImmediate(
            BasicBlock bb,
            List<BasicBlock> edges,
            F<BasicBlock, Integer> idOf,
            F<BasicBlock, TopologyNode> nodeOf
    ) {
        int id = idOf.apply(bb);
        BasicBlock candidate = null;
        for (BasicBlock other : edges) {
            if (idOf.apply(other) >= id) continue; // back edge
            if (candidate == null) {
                candidate = other;
                continue;
            }
            BasicBlock alternate = other;
            while (alternate != candidate) {
                if (candidate == null || alternate == null) {
                    throw new IllegalStateException("no common ancestor above " + bb.toTargetString());
                }
                if (idOf.apply(candidate) > idOf.apply(alternate)) {
                    candidate = nodeOf.apply(candidate).parent;
                } else {
                    alternate = nodeOf.apply(alternate).parent;
                }
            }
        }
        TopologyNode node = nodeOf.apply(bb);
        node.reset();
        node.parent = candidate;
    }

    /**
     * Number a (post-)dominator tree so that every subtree occupies a consecutive range of ids.
     *
     * @param order  The blocks, with every parent before its children.
     * @param nodeOf Which tree to number.
     */
    public static void numberTree(List<BasicBlock> order, F<BasicBlock, TopologyNode> nodeOf) {
        // sizes bottom-up, each child's id starting out relative to its parent
        for (int i = order.size() - 1; i >= 0; i--) {
            TopologyNode node = nodeOf.apply(order.get(i));
            if (node.parent != null) {
                TopologyNode parent = nodeOf.apply(node.parent);
                node.nodeID = parent.sizeOfSubTree;
                parent.sizeOfSubTree += node.sizeOfSubTree;
            }
        }
        for (BasicBlock bb : order) {
            TopologyNode node = nodeOf.apply(bb);
            if (node.parent != null) {
                node.nodeID += nodeOf.apply(node.parent).nodeID;
            }
        }
    }
}
