package io.github.eutro.til2cfg.test;

import io.github.eutro.til2cfg.passes.CFGPass;
import io.github.eutro.til2cfg.passes.IRPass;
import io.github.eutro.til2cfg.passes.meta.CheckNormalForm;
import io.github.eutro.til2cfg.passes.meta.ComputeNormalForm;
import io.github.eutro.til2cfg.passes.misc.ChainedPass;
import io.github.eutro.til2cfg.ssa.SCFG;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void chainsAreFlat() {
        IRPass<SCFG, SCFG> chain = ComputeNormalForm.INSTANCE
                .then(CheckNormalForm.INSTANCE)
                .then(CheckNormalForm.INSTANCE);
        assertInstanceOf(ChainedPass.class, chain);
        assertEquals(3, ((ChainedPass<?, ?>) chain).getPasses().size());
    }

    @Test
    void passesRunInOrder() {
        List<String> ran = new ArrayList<>();
        CFGPass first = cfg -> ran.add("first");
        CFGPass second = cfg -> ran.add("second");
        SCFG cfg = new SCFG();
        assertSame(cfg, first.then(second).run(cfg));
        assertEquals(Arrays.asList("first", "second"), ran);
    }

    @Test
    void failuresNameTheirPass() {
        CFGPass noop = cfg -> {
        };
        CFGPass failing = cfg -> {
            throw new IllegalStateException("bad block");
        };
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> noop.then(noop).then(failing).run(new SCFG()));
        assertEquals("bad block", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("in pass 3 of 3"));
    }
}
