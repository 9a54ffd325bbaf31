package io.github.eutro.til2cfg.test;

import io.github.eutro.til2cfg.diag.DiagnosticEmitter;
import io.github.eutro.til2cfg.diag.ReducerException;
import io.github.eutro.til2cfg.ext.CommonExts;
import io.github.eutro.til2cfg.ext.MetadataState;
import io.github.eutro.til2cfg.passes.CFGPass;
import io.github.eutro.til2cfg.passes.convert.CFGReducer;
import io.github.eutro.til2cfg.passes.meta.CheckNormalForm;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.til.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.til2cfg.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class CFGReducerTest {
    private static SCFG lowerToCfg(SExpr e) {
        return cfgOf(CFGReducer.lower(e));
    }

    private static void assertDominanceIsATree(SCFG cfg) {
        List<BasicBlock> blocks = cfg.getBlocks();
        for (BasicBlock a : blocks) {
            assertTrue(a.dominates(a));
            if (a == cfg.getEntry()) {
                assertNull(a.getIDom());
            } else {
                assertNotNull(a.getIDom());
                assertTrue(a.getIDom().dominates(a));
            }
            for (BasicBlock b : blocks) {
                for (BasicBlock c : blocks) {
                    if (a.dominates(b) && b.dominates(c)) {
                        assertTrue(a.dominates(c));
                    }
                }
                if (a != b && a.dominates(b)) {
                    assertFalse(b.dominates(a));
                }
            }
        }
    }

    @Test
    void tailRecursionBecomesALoop() {
        // f(x) = if x <= 0 then x else f(x - 1)
        SExpr body = ite(bin(BinaryOp.Kind.LEQ, id("x"), lit(0)),
                id("x"),
                call(id("f"), bin(BinaryOp.Kind.SUB, id("x"), lit(1))));
        SCFG cfg = lowerToCfg(code(letrec("f", fn("x", code(body)), call(id("f"), lit(10)))));

        assertTrue(cfg.isNormal());
        assertTrue(cfg.getMetadata().isValid(MetadataState.SSA_FORM));
        assertEquals(5, cfg.getBlocks().size());
        assertEquals(2, count(cfg, Opcode.BINARY_OP));

        BasicBlock entry = cfg.getEntry();
        Goto enter = (Goto) entry.getTerminator();
        BasicBlock loop = enter.getTarget();
        assertEquals(1, loop.getArguments().size());
        Phi x = loop.getArguments().get(0);
        assertEquals("x", x.getName());
        assertEquals(10, literalValue(x.values().get(enter.getIndex())));

        assertEquals(2, loop.getPredecessors().size());
        BasicBlock latch = null;
        for (BasicBlock pred : loop.getPredecessors()) {
            if (pred != entry) latch = pred;
        }
        assertNotNull(latch);
        assertTrue(latch.getBlockID() > loop.getBlockID());
        assertSame(loop, ((Goto) latch.getTerminator()).getTarget());

        // the loop header decides between leaving and going around again
        assertTrue(loop.getTerminator() instanceof Branch);
        assertEquals(1, loop.getInstructions().size());
        for (BasicBlock bb : cfg.getBlocks()) {
            if (bb != entry) {
                assertTrue(loop.dominates(bb), bb.toTargetString());
            }
        }
        assertSame(loop, entry.getIPostDom());
        assertDominanceIsATree(cfg);
    }

    @Test
    void conditionalValueGetsAJoinBlock() {
        SExpr lowered = CFGReducer.lower(fn("c", code(
                let("v", ite(id("c"), lit(1), lit(2)), id("v")))));
        SCFG cfg = cfgOf(lowered);
        assertEquals(5, cfg.getBlocks().size());

        BasicBlock exit = cfg.getExit();
        assertEquals(1, exit.getPredecessors().size());
        BasicBlock join = exit.getPredecessors().get(0);
        assertEquals(1, join.getArguments().size());
        Phi v = join.getArguments().get(0);
        assertEquals("v", v.getName());
        assertSame(v, exit.getArguments().get(0).values().get(0));

        assertEquals(2, join.getPredecessors().size());
        List<Object> incoming = new ArrayList<>();
        for (SExpr value : v.values()) {
            incoming.add(literalValue(value));
        }
        assertEquals(2, incoming.size());
        assertTrue(incoming.contains(1));
        assertTrue(incoming.contains(2));
        for (int i = 0; i < 2; i++) {
            BasicBlock pred = join.getPredecessors().get(i);
            assertEquals(i, ((Goto) pred.getTerminator()).getIndex());
        }

        Branch br = (Branch) cfg.getEntry().getTerminator();
        assertTrue(br.getCondition() instanceof Variable);
        assertEquals("c", ((Variable) br.getCondition()).getDecl().getName());
        assertSame(cfg.getEntry(), join.getIDom());
        assertDominanceIsATree(cfg);
    }

    @Test
    void nestedTailConditionalsShareTheExit() {
        SCFG cfg = lowerToCfg(fn("a", fn("b", code(
                ite(id("a"), ite(id("b"), lit(1), lit(2)), lit(3))))));
        assertEquals(6, cfg.getBlocks().size());
        assertEquals(3, cfg.getExit().getPredecessors().size());
        for (BasicBlock bb : cfg.getBlocks()) {
            if (bb != cfg.getExit()) {
                assertTrue(bb.getArguments().isEmpty());
            }
        }
        assertDominanceIsATree(cfg);
    }

    @Test
    void localFunctionsTakeAllTheirArguments() {
        SCFG cfg = lowerToCfg(code(letrec("g",
                fn("a", fn("b", code(bin(BinaryOp.Kind.SUB, id("a"), id("b"))))),
                call(id("g"), lit(5), lit(3)))));
        Goto enter = (Goto) cfg.getEntry().getTerminator();
        List<Phi> params = enter.getTarget().getArguments();
        assertEquals(2, params.size());
        assertEquals("a", params.get(0).getName());
        assertEquals("b", params.get(1).getName());
        assertEquals(5, literalValue(params.get(0).values().get(0)));
        assertEquals(3, literalValue(params.get(1).values().get(0)));

        BinaryOp sub = (BinaryOp) enter.getTarget().getInstructions().get(0);
        assertSame(params.get(0), sub.getLhs());
        assertSame(params.get(1), sub.getRhs());
    }

    @Test
    void callsFromDifferentContinuationsFail() {
        SExpr e = code(letrec("f", fn("x", code(id("x"))),
                bin(BinaryOp.Kind.ADD, call(id("f"), lit(1)), call(id("f"), lit(2)))));
        ReducerException ex = assertThrows(ReducerException.class, () -> CFGReducer.lower(e));
        assertEquals(ReducerException.Kind.CONTINUATION_MISMATCH, ex.getKind());
    }

    @Test
    void nonTailCallOfLocalFunction() {
        SCFG cfg = lowerToCfg(code(letrec("f", fn("x", code(bin(BinaryOp.Kind.MUL, id("x"), lit(2)))),
                bin(BinaryOp.Kind.ADD, call(id("f"), lit(1)), lit(1)))));
        // entry, exit, f, and the block the call returns to
        assertEquals(4, cfg.getBlocks().size());
        BasicBlock exit = cfg.getExit();
        BasicBlock ret = exit.getPredecessors().get(0);
        assertEquals(1, ret.getArguments().size());
        BinaryOp add = (BinaryOp) ret.getInstructions().get(0);
        assertSame(ret.getArguments().get(0), add.getLhs());
        assertDominanceIsATree(cfg);
    }

    @Test
    void infiniteLoopsCannotReachTheExit() {
        SExpr e = code(letrec("f", fn("x", code(call(id("f"), id("x")))), call(id("f"), lit(0))));
        ReducerException ex = assertThrows(ReducerException.class, () -> CFGReducer.lower(e));
        assertEquals(ReducerException.Kind.UNREACHABLE_BLOCKS, ex.getKind());
    }

    @Test
    void uncalledLocalFunctionsAreDropped() {
        SCFG cfg = lowerToCfg(code(letrec("f", fn("x", code(id("x"))), lit(7))));
        assertEquals(2, cfg.getBlocks().size());
        assertEquals(7, literalValue(cfg.getExit().getArguments().get(0).values().get(0)));
    }

    @Test
    void unknownCalleesAreCalled() {
        SCFG cfg = lowerToCfg(fn("h", code(call(id("h"), lit(1)))));
        assertEquals(2, cfg.getBlocks().size());
        List<Instruction> insns = cfg.getEntry().getInstructions();
        assertEquals(1, insns.size());
        Call c = (Call) insns.get(0);
        Apply ap = (Apply) c.getTarget();
        assertTrue(ap.getFn() instanceof Variable);
        assertSame(c, cfg.getExit().getArguments().get(0).values().get(0));
    }

    @Test
    void letOutsideCodeIsKept() {
        SExpr lowered = CFGReducer.lower(let("k", lit(4), code(bin(BinaryOp.Kind.ADD, id("k"), id("k")))));
        Let let = (Let) lowered;
        assertEquals(4, literalValue(let.getDecl().getDefinition()));
        SCFG cfg = cfgOf(let.getBody());
        assertEquals(1, count(cfg, Opcode.BINARY_OP));
    }

    @Test
    void unresolvedIdentifiersAreReported() {
        StringBuilder out = new StringBuilder();
        DiagnosticEmitter diagnostics = new DiagnosticEmitter(out);
        CFGReducer reducer = new CFGReducer(CheckNormalForm.INSTANCE, diagnostics);

        SCFG cfg = cfgOf(reducer.run(code(bin(BinaryOp.Kind.ADD, id("y"), lit(1)))));
        assertEquals(1, diagnostics.getErrorCount());
        assertEquals("error: unresolved identifier 'y'\n", out.toString());

        BinaryOp add = (BinaryOp) cfg.getExit().getArguments().get(0).values().get(0);
        assertTrue(add.getLhs() instanceof Identifier);
        assertTrue(CommonExts.isUnresolved(add.getLhs()));
    }

    @Test
    void letBoundValuesAreNotRecomputed() {
        SCFG cfg = lowerToCfg(fn("a", code(let("y", bin(BinaryOp.Kind.ADD, id("a"), lit(1)),
                bin(BinaryOp.Kind.MUL, id("y"), id("y"))))));
        assertEquals(2, count(cfg, Opcode.BINARY_OP));
        BinaryOp mul = (BinaryOp) cfg.getEntry().getInstructions().get(1);
        assertSame(mul.getLhs(), mul.getRhs());
        assertEquals("y", ((Instruction) mul.getLhs()).getName());
    }

    @Test
    void separateLoweringsKeepSeparateDiagnostics() {
        DiagnosticEmitter first = new DiagnosticEmitter(new StringBuilder());
        DiagnosticEmitter second = new DiagnosticEmitter(new StringBuilder());
        CFGReducer.lower(code(id("a")), first);
        CFGReducer.lower(code(id("b")), second);
        assertEquals(1, first.getErrorCount());
        assertEquals(1, second.getErrorCount());
    }

    @Test
    void ssaPassRunsOncePerNormalizedCfg() {
        List<Boolean> normal = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        CFGPass recorder = cfg -> {
            normal.add(cfg.isNormal());
            sizes.add(cfg.getBlocks().size());
        };
        CFGReducer reducer = new CFGReducer(recorder, new DiagnosticEmitter(new StringBuilder()));

        SExpr lowered = reducer.run(let("k",
                code(letrec("f", fn("x", code(id("x"))), call(id("f"), lit(1)))),
                code(lit(2))));
        assertEquals(2, normal.size());
        assertFalse(normal.contains(false));
        // the local block of the first CFG does not leak into the second
        assertEquals(3, (int) sizes.get(0));
        assertEquals(2, (int) sizes.get(1));

        Let let = (Let) lowered;
        assertTrue(cfgOf(let.getDecl().getDefinition()).getMetadata().isValid(MetadataState.SSA_FORM));
        assertTrue(cfgOf(let.getBody()).getMetadata().isValid(MetadataState.SSA_FORM));
    }

    @Test
    void letBoundLocalFunctionsAlsoTakeTheEnclosingParameters() {
        SExpr e = fn("x", code(let("g", fn("y", code(id("y"))), call(id("g"), lit(1)))));
        ReducerException ex = assertThrows(ReducerException.class, () -> CFGReducer.lower(e));
        assertEquals(ReducerException.Kind.ARITY_MISMATCH, ex.getKind());
    }
}
