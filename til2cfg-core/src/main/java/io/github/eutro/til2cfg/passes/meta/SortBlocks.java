package io.github.eutro.til2cfg.passes.meta;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.SCFG;

import java.util.HashSet;
import java.util.Set;

/**
 * Depth-first orderings of the blocks of an {@link SCFG}.
 * <p>
 * Both sorts fill the order array from the back, and return how many slots
 * are left over at the front: the number of blocks the walk never reached.
 * Edges to blocks already visited are back edges and are not followed again.
 */
public final class SortBlocks {
    private SortBlocks() {
    }

    /**
     * Sort the blocks following predecessors from the exit, setting each block's
     * {@link BasicBlock#getPostBlockID() post block id} to its index in {@code order}.
     * <p>
     * The immediate dominator of a block, if one was computed before, is sorted before the block's
     * predecessors, so that dominators come after the blocks they dominate.
     *
     * @param cfg   The CFG.
     * @param order The array to sort into, as long as the block list.
     * @return The number of blocks not reached from the exit.
     */
    public static int postTopological(SCFG cfg, BasicBlock[] order) {
        class Runner {
            final Set<BasicBlock> seen = new HashSet<>();
            int id = order.length;

            void visit(BasicBlock bb) {
                if (!seen.add(bb)) return;
                if (bb.dominatorNode.parent != null) {
                    visit(bb.dominatorNode.parent);
                }
                for (BasicBlock pred : bb.getPredecessors()) {
                    visit(pred);
                }
                bb.setPostBlockID(place(bb));
            }

            int place(BasicBlock bb) {
                if (id <= 0) {
                    throw new IllegalStateException("block " + bb.toTargetString() + " is not in the CFG's block list");
                }
                order[--id] = bb;
                return id;
            }
        }
        Runner runner = new Runner();
        runner.visit(cfg.getExit());
        return runner.id;
    }

    /**
     * Sort the blocks following successors from the entry, setting each block's
     * {@link BasicBlock#getBlockID() block id} to its index in {@code order}.
     * <p>
     * The immediate post-dominator of a block is sorted before the block's successors,
     * so that post-dominators come after the blocks they post-dominate, wherever a loop allows it.
     *
     * @param cfg   The CFG, whose post-dominators are already computed.
     * @param order The array to sort into, as long as the block list.
     * @return The number of blocks not reached from the entry.
     */
    public static int topological(SCFG cfg, BasicBlock[] order) {
        class Runner {
            final Set<BasicBlock> seen = new HashSet<>();
            int id = order.length;

            void visit(BasicBlock bb) {
                if (!seen.add(bb)) return;
                if (bb.postDominatorNode.parent != null) {
                    visit(bb.postDominatorNode.parent);
                }
                for (BasicBlock succ : bb.successors()) {
                    visit(succ);
                }
                if (id <= 0) {
                    throw new IllegalStateException("block " + bb.toTargetString() + " is not in the CFG's block list");
                }
                order[--id] = bb;
                bb.setBlockID(id);
            }
        }
        Runner runner = new Runner();
        runner.visit(cfg.getEntry());
        return runner.id;
    }
}
