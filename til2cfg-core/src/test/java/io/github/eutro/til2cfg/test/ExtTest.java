package io.github.eutro.til2cfg.test;

import io.github.eutro.til2cfg.ext.CommonExts;
import io.github.eutro.til2cfg.ext.Ext;
import io.github.eutro.til2cfg.ext.ExtHolder;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.SCFG;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExtTest {
    private static final Ext<Integer> LOOP_DEPTH = Ext.create(Integer.class, "loopDepth");

    @Test
    void attachAndRemove() {
        ExtHolder holder = new ExtHolder();
        assertNull(holder.getNullable(LOOP_DEPTH));
        holder.attachExt(LOOP_DEPTH, 2);
        assertEquals(Integer.valueOf(2), holder.getExtOrThrow(LOOP_DEPTH));
        holder.removeExt(LOOP_DEPTH);
        assertThrows(IllegalStateException.class, () -> holder.getExtOrThrow(LOOP_DEPTH));
    }

    @Test
    void blocksKnowTheirCfg() {
        SCFG cfg = new SCFG();
        BasicBlock bb = cfg.newBlock(0);
        assertSame(cfg, bb.getNullable(CommonExts.OWNING_CFG));
        assertTrue(cfg.getBlocks().remove(bb));
        assertNull(bb.getNullable(CommonExts.OWNING_CFG));
    }

    @Test
    void metadataStateIsFixed() {
        SCFG cfg = new SCFG();
        assertNotNull(cfg.getNullable(CommonExts.METADATA_STATE));
        assertThrows(UnsupportedOperationException.class, () -> cfg.removeExt(CommonExts.METADATA_STATE));
    }
}
