package io.github.eutro.til2cfg.test;

import io.github.eutro.til2cfg.diag.ReducerException;
import io.github.eutro.til2cfg.passes.Passes;
import io.github.eutro.til2cfg.passes.meta.CheckNormalForm;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.IRBuilder;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.til.Branch;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.eutro.til2cfg.test.Trees.lit;
import static org.junit.jupiter.api.Assertions.*;

public class NormalFormTest {
    @Test
    void diamond() {
        SCFG cfg = new SCFG();
        IRBuilder ib = new IRBuilder(cfg);
        ib.startBlock(cfg.getEntry());
        Branch br = ib.branch(lit(true));
        BasicBlock a = br.getThenBlock();
        BasicBlock b = br.getElseBlock();
        ib.startBlock(a);
        ib.jump(cfg.getExit(), lit(1));
        ib.startBlock(b);
        ib.jump(cfg.getExit(), lit(2));

        assertFalse(cfg.isNormal());
        Passes.NORMALIZE.run(cfg);
        assertTrue(cfg.isNormal());

        BasicBlock entry = cfg.getEntry();
        BasicBlock exit = cfg.getExit();
        assertEquals(4, cfg.getBlocks().size());
        assertEquals(0, entry.getBlockID());
        assertEquals(3, exit.getBlockID());

        assertTrue(entry.dominates(a));
        assertTrue(entry.dominates(b));
        assertTrue(entry.dominates(exit));
        assertFalse(a.dominates(b));
        assertFalse(b.dominates(a));
        assertFalse(a.dominates(exit));
        assertFalse(b.dominates(exit));
        assertSame(entry, exit.getIDom());
        assertNull(entry.getIDom());

        assertSame(exit, entry.getIPostDom());
        assertSame(exit, a.getIPostDom());
        assertSame(exit, b.getIPostDom());
        assertNull(exit.getIPostDom());
        assertTrue(exit.postDominates(entry));
        assertFalse(a.postDominates(entry));
    }

    @Test
    void addingBlocksInvalidatesNormalForm() {
        SCFG cfg = new SCFG();
        IRBuilder ib = new IRBuilder(cfg);
        ib.startBlock(cfg.getEntry());
        ib.jump(cfg.getExit(), lit(0));
        cfg.computeNormalForm();
        assertTrue(cfg.isNormal());
        CheckNormalForm.INSTANCE.run(cfg);

        cfg.newBlock(0);
        assertFalse(cfg.isNormal());
        assertThrows(IllegalStateException.class, () -> CheckNormalForm.INSTANCE.run(cfg));
    }

    @Test
    void blocksMissingFromEntryAreRejected() {
        SCFG cfg = new SCFG();
        IRBuilder ib = new IRBuilder(cfg);
        ib.startBlock(cfg.getEntry());
        ib.jump(cfg.getExit(), lit(0));
        BasicBlock orphan = cfg.newBlock(0);
        ib.startBlock(orphan);
        ib.jump(cfg.getExit(), lit(1));

        ReducerException e = assertThrows(ReducerException.class, cfg::computeNormalForm);
        assertEquals(ReducerException.Kind.UNREACHABLE_BLOCKS, e.getKind());
    }

    @Test
    void blocksMissingFromExitAreRejected() {
        SCFG cfg = new SCFG();
        IRBuilder ib = new IRBuilder(cfg);
        ib.startBlock(cfg.getEntry());
        BasicBlock loop = cfg.newBlock(0);
        ib.jump(loop, Collections.emptyList());
        ib.startBlock(loop);
        ib.jump(loop, Collections.emptyList());

        ReducerException e = assertThrows(ReducerException.class, cfg::computeNormalForm);
        assertEquals(ReducerException.Kind.UNREACHABLE_BLOCKS, e.getKind());
    }
}
