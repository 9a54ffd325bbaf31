package io.github.eutro.til2cfg.passes.meta;

import io.github.eutro.til2cfg.passes.CFGPass;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.til.Phi;
import io.github.eutro.til2cfg.util.F;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that an {@link SCFG} is in the shape {@link ComputeNormalForm} promises,
 * throwing an {@link IllegalStateException} describing the first problem found.
 */
public class CheckNormalForm implements CFGPass {
    public static final CheckNormalForm INSTANCE = new CheckNormalForm();

    @Override
    public void runOn(SCFG cfg) {
        if (!cfg.isNormal()) {
            fail(cfg, "CFG is not in normal form");
        }
        List<BasicBlock> blocks = cfg.getBlocks();
        if (blocks.isEmpty() || blocks.get(0) != cfg.getEntry()) {
            fail(cfg, "entry is not the first block");
        }
        if (!cfg.getEntry().getPredecessors().isEmpty()) {
            fail(cfg, "entry has predecessors");
        }
        if (!cfg.getExit().successors().isEmpty()) {
            fail(cfg, "exit has successors");
        }

        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock bb = blocks.get(i);
            if (bb.getBlockID() != i) {
                fail(cfg, bb.toTargetString() + " is at index " + i);
            }
            if (bb.getTerminator() == null) {
                fail(cfg, bb.toTargetString() + " has no terminator");
            }
            for (Phi phi : bb.getArguments()) {
                if (phi.values().size() != bb.getPredecessors().size()) {
                    fail(cfg, bb.toTargetString() + " has a phi with " + phi.values().size()
                            + " values but " + bb.getPredecessors().size() + " predecessors");
                }
            }
            if (!bb.dominates(bb) || !bb.postDominates(bb)) {
                fail(cfg, bb.toTargetString() + " does not dominate itself");
            }
            BasicBlock idom = bb.getIDom();
            if (bb == cfg.getEntry()) {
                if (idom != null) fail(cfg, "entry has an immediate dominator");
            } else if (idom == null || idom.getBlockID() >= bb.getBlockID() || !idom.dominates(bb)) {
                fail(cfg, bb.toTargetString() + " has no valid immediate dominator");
            }
            BasicBlock ipdom = bb.getIPostDom();
            if (bb != cfg.getExit() && (ipdom == null || !ipdom.postDominates(bb))) {
                fail(cfg, bb.toTargetString() + " has no valid immediate post-dominator");
            }
        }

        checkReaches(cfg, cfg.getEntry(), BasicBlock::successors, "entry");
        checkReaches(cfg, cfg.getExit(), BasicBlock::getPredecessors, "exit");
    }

    private static void checkReaches(SCFG cfg, BasicBlock root, F<BasicBlock, List<BasicBlock>> edges, String from) {
        Set<BasicBlock> reached = new HashSet<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        reached.add(root);
        stack.push(root);
        while (!stack.isEmpty()) {
            for (BasicBlock next : edges.apply(stack.pop())) {
                if (reached.add(next)) stack.push(next);
            }
        }
        for (BasicBlock bb : cfg.getBlocks()) {
            if (!reached.contains(bb)) {
                fail(cfg, bb.toTargetString() + " is not connected to the " + from);
            }
        }
    }

    private static void fail(SCFG cfg, String message) {
        throw new IllegalStateException(message + " in\n" + cfg);
    }
}
