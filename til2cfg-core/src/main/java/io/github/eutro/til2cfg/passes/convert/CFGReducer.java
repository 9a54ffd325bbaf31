package io.github.eutro.til2cfg.passes.convert;

import io.github.eutro.til2cfg.diag.DiagnosticEmitter;
import io.github.eutro.til2cfg.ext.CommonExts;
import io.github.eutro.til2cfg.ext.MetadataState;
import io.github.eutro.til2cfg.passes.IRPass;
import io.github.eutro.til2cfg.passes.meta.CheckNormalForm;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.IRBuilder;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.til.*;
import io.github.eutro.til2cfg.util.Logging;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Lowers an expression tree, replacing the body of every top-level {@link Code} block with an {@link SCFG}.
 * <p>
 * Inside a CFG:
 * <ul>
 *     <li>conditionals become branches, joined by a block with one argument if they produce a value;</li>
 *     <li>local functions become blocks, whose arguments are the function's parameters,
 *     and calls to them become jumps;</li>
 *     <li>lets disappear, with references to a let-bound name replaced by its value.</li>
 * </ul>
 * Every call to a local function must continue the same way, that is, they must all be tail calls of
 * the same enclosing expression, or a {@link io.github.eutro.til2cfg.diag.ReducerException ReducerException} is thrown.
 * <p>
 * A local function takes as arguments every function parameter directly in scope where it is defined,
 * including those of the enclosing top-level lambdas. A local function bound by a {@code let} under a
 * parameterised top-level code block therefore takes that parameter too, and calling it with only its
 * own arguments is an arity mismatch. Bind such functions outside the parameter list instead.
 * <p>
 * Each CFG is brought into normal form, and then given to the SSA pass exactly once.
 */
public class CFGReducer implements IRPass<SExpr, SExpr> {
    public static final boolean CHECK_NORMAL_FORM = System.getenv("TIL2CFG_CHECK_NORMAL_FORM") != null;

    private static final Logger LOGGER = Logging.getLogger();

    private final IRPass<SCFG, SCFG> ssaPass;
    private final DiagnosticEmitter diagnostics;

    /**
     * Construct a reducer.
     *
     * @param ssaPass     The pass to run on every CFG once it is in normal form.
     * @param diagnostics Where to report unresolved identifiers.
     */
    public CFGReducer(IRPass<SCFG, SCFG> ssaPass, DiagnosticEmitter diagnostics) {
        this.ssaPass = CHECK_NORMAL_FORM ? CheckNormalForm.INSTANCE.then(ssaPass) : ssaPass;
        this.diagnostics = diagnostics;
    }

    public DiagnosticEmitter getDiagnostics() {
        return diagnostics;
    }

    /**
     * Lower {@code e}, checking each CFG it produces and reporting to standard error.
     *
     * @param e The expression.
     * @return The lowered expression.
     */
    public static SExpr lower(SExpr e) {
        return lower(e, new DiagnosticEmitter());
    }

    /**
     * Lower {@code e}, checking each CFG it produces.
     * <p>
     * Each call uses a fresh reducer, so separate compilations share nothing but {@code diagnostics}.
     *
     * @param e           The expression.
     * @param diagnostics Where to report unresolved identifiers.
     * @return The lowered expression.
     */
    public static SExpr lower(SExpr e, DiagnosticEmitter diagnostics) {
        return new CFGReducer(CheckNormalForm.INSTANCE, diagnostics).run(e);
    }

    @Override
    public SExpr run(SExpr e) {
        Reduction r = new Lowering().reduce(e, TraversalKind.TAIL, TranslationState.initial(new VarContext()));
        return Objects.requireNonNull(r.value);
    }

    private class Lowering {
        @Nullable
        SCFG cfg;
        @Nullable
        IRBuilder ib;
        final List<PendingBlock> pendingBlocks = new ArrayList<>();
        final Map<Code, Integer> codeMap = new IdentityHashMap<>();
        final Deque<Integer> queue = new ArrayDeque<>();

        Reduction reduce(@Nullable SExpr e, TraversalKind k, TranslationState st) {
            if (e == null) return new Reduction(null, st);
            if (k != TraversalKind.TAIL && st.continuation != null) {
                // only tail positions continue anywhere
                Reduction r = reduce(e, k, st.withContinuation(null));
                return new Reduction(r.value, r.state.withContinuation(st.continuation));
            }

            Reduction r = reduceNode(e, k, st);
            TranslationState after = r.state;
            if (after.block != null) {
                builder().insert(r.value);
                if (k == TraversalKind.TAIL && after.continuation != null) {
                    builder().jump(after.continuation, r.value);
                    return new Reduction(null, after.withBlock(null));
                }
            }
            return r;
        }

        private Reduction reduceNode(SExpr e, TraversalKind k, TranslationState st) {
            switch (e.opcode()) {
                case LITERAL:
                    return new Reduction(new Literal(((Literal) e).getValue()), st);
                case IDENTIFIER:
                    return new Reduction(resolve((Identifier) e, st.scope), st);
                case VARIABLE:
                    return new Reduction(new Variable(((Variable) e).getDecl()), st);
                case FUNCTION:
                    return reduceFunction((Function) e, st);
                case CODE:
                    return cfg == null
                            ? reduceTopLevelCode((Code) e, st)
                            : reduceLocalCode((Code) e, st);
                case APPLY:
                    return reduceApply((Apply) e, st);
                case CALL:
                    return reduceCall((Call) e, st);
                case PROJECT: {
                    Project p = (Project) e;
                    Reduction rec = reduce(p.getRecord(), TraversalKind.NORMAL, st);
                    return new Reduction(new Project(value(rec, p), p.getSlotName()), rec.state);
                }
                case UNARY_OP: {
                    UnaryOp op = (UnaryOp) e;
                    Reduction x = reduce(op.getOperand(), TraversalKind.NORMAL, st);
                    return new Reduction(new UnaryOp(op.getKind(), value(x, op)), x.state);
                }
                case BINARY_OP: {
                    BinaryOp op = (BinaryOp) e;
                    Reduction lhs = reduce(op.getLhs(), TraversalKind.NORMAL, st);
                    Reduction rhs = reduce(op.getRhs(), TraversalKind.NORMAL, lhs.state);
                    return new Reduction(new BinaryOp(op.getKind(), value(lhs, op), value(rhs, op)), rhs.state);
                }
                case IF_THEN_ELSE:
                    return reduceIfThenElse((IfThenElse) e, st);
                case LET:
                    return reduceLet((Let) e, k, st);
                case LETREC:
                    return reduceLetrec((Letrec) e, k, st);
                default:
                    throw new IllegalArgumentException("cannot lower " + e.opcode().getName() + ": " + e);
            }
        }

        private SExpr resolve(Identifier id, VarContext scope) {
            Optional<VarDecl> found = scope.lookup(id.getName());
            if (found.isPresent()) {
                VarDecl vd = found.get();
                if (vd.getKind() != VarDecl.Kind.FUN && vd.getDefinition() != null) {
                    return vd.getDefinition();
                }
                return new Variable(vd);
            }
            diagnostics.error("unresolved identifier '%s'", id.getName());
            LOGGER.warn("unresolved identifier " + id.getName() + ", leaving it in place");
            Identifier placeholder = new Identifier(id.getName());
            placeholder.attachExt(CommonExts.UNRESOLVED, true);
            return placeholder;
        }

        private Reduction reduceFunction(Function fn, TranslationState st) {
            VarDecl nvd = new VarDecl(fn.getParam().getName(), VarDecl.Kind.FUN, null);
            enterScope(st, nvd);
            Reduction body = reduce(fn.getBody(), TraversalKind.DECL, st);
            exitScope(body.state, nvd);
            return new Reduction(new Function(nvd, value(body, fn)), body.state);
        }

        private Reduction reduceTopLevelCode(Code code, TranslationState st) {
            if (code.getBody() == null) {
                return new Reduction(new Code(code.getReturnType(), null), st);
            }

            SCFG cfg = this.cfg = new SCFG();
            IRBuilder ib = this.ib = new IRBuilder(cfg);
            LOGGER.debug("starting CFG");
            ib.startBlock(cfg.getEntry());
            reduce(code.getBody(),
                    TraversalKind.TAIL,
                    new TranslationState(cfg.getEntry(), cfg.getExit(), st.scope, Collections.emptyList()));
            if (ib.getBlock() != null) {
                throw new IllegalStateException("never finished block " + ib.getBlock().toTargetString());
            }
            drainPendingBlocks();

            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("initial CFG:\n" + cfg);
            }
            cfg.computeNormalForm();
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("normal form:\n" + cfg);
            }
            SCFG result = ssaPass.run(cfg);
            result.getMetadata().validate(MetadataState.SSA_FORM);
            LOGGER.debug("finished CFG with " + result.getBlocks().size() + " blocks");

            this.cfg = null;
            this.ib = null;
            pendingBlocks.clear();
            codeMap.clear();
            queue.clear();
            return new Reduction(new Code(code.getReturnType(), result), st);
        }

        private Reduction reduceLocalCode(Code code, TranslationState st) {
            if (code.getBody() == null) {
                throw new IllegalArgumentException("local code block has no body: " + code);
            }
            // the parameters of the enclosing lambdas are innermost in scope
            VarContext scope = st.scope;
            int nargs = 0;
            while (nargs < scope.size() && scope.get(nargs).getKind() == VarDecl.Kind.FUN) {
                nargs++;
            }

            BasicBlock block = BasicBlock.withArguments(nargs);
            VarContext captured = scope.clone();
            for (int i = 0; i < nargs; i++) {
                int j = nargs - 1 - i;
                String name = scope.get(j).getName();
                Phi phi = block.getArguments().get(i);
                phi.setName(name);
                captured.set(j, new VarDecl(name, VarDecl.Kind.LET, phi));
            }

            int pi = pendingBlocks.size();
            pendingBlocks.add(new PendingBlock(code.getBody(), block, captured));
            Code lowered = new Code(code.getReturnType(), block);
            codeMap.put(lowered, pi);
            return new Reduction(lowered, st);
        }

        private Reduction reduceApply(Apply apply, TranslationState st) {
            Reduction fn = reduce(apply.getFn(), TraversalKind.NORMAL, st);
            Reduction arg = reduce(apply.getArg(), TraversalKind.NORMAL, fn.state);
            SExpr f = value(fn, apply);
            SExpr a = value(arg, apply);
            if (f instanceof Function && isLocalBlock(f)) {
                // the call consumes the argument as a jump argument
                return new Reduction(((Function) f).getBody(), arg.state.pushArg(a));
            }
            return new Reduction(new Apply(f, a), arg.state);
        }

        private boolean isLocalBlock(SExpr f) {
            while (f instanceof Function) {
                f = ((Function) f).getBody();
            }
            return f instanceof Code && codeMap.containsKey(f);
        }

        private Reduction reduceCall(Call call, TranslationState st) {
            List<SExpr> saved = st.pendingArgs;
            Reduction target = reduce(call.getTarget(),
                    TraversalKind.NORMAL,
                    st.withPendingArgs(Collections.emptyList()));
            List<SExpr> args = target.state.pendingArgs;
            TranslationState after = target.state.withPendingArgs(saved);

            SExpr callee = value(target, call);
            if (callee instanceof Code) {
                Integer pi = codeMap.get(callee);
                if (pi != null) {
                    return jumpToLocal(pi, args, after);
                }
            }

            SExpr f = callee;
            for (SExpr a : args) {
                f = new Apply(f, a);
            }
            return new Reduction(new Call(f), after);
        }

        private Reduction jumpToLocal(int pi, List<SExpr> args, TranslationState st) {
            PendingBlock pb = pendingBlocks.get(pi);
            BasicBlock cont = st.continuation;
            boolean fresh = cont == null;
            if (fresh) {
                cont = BasicBlock.withArguments(1);
            }
            pb.setContinuation(cont);
            builder().jump(pb.block, args);
            queue.add(pi);

            if (fresh) {
                builder().startBlock(cont);
                return new Reduction(cont.getArguments().get(0), st.withBlock(cont));
            }
            return new Reduction(null, st.withBlock(null));
        }

        private Reduction reduceIfThenElse(IfThenElse ite, TranslationState st) {
            if (st.block == null) {
                Reduction cond = reduce(ite.getCondition(), TraversalKind.NORMAL, st);
                Reduction thenR = reduce(ite.getThenExpr(), TraversalKind.NORMAL, cond.state);
                Reduction elseR = reduce(ite.getElseExpr(), TraversalKind.NORMAL, thenR.state);
                return new Reduction(new IfThenElse(value(cond, ite), value(thenR, ite), value(elseR, ite)), elseR.state);
            }

            Reduction cond = reduce(ite.getCondition(), TraversalKind.NORMAL, st);
            Branch br = builder().branch(value(cond, ite));

            BasicBlock saved = cond.state.continuation;
            BasicBlock cont = saved != null ? saved : BasicBlock.withArguments(1);

            builder().startBlock(br.getThenBlock());
            Reduction thenR = reduce(ite.getThenExpr(),
                    TraversalKind.TAIL,
                    cond.state.withBlock(br.getThenBlock()).withContinuation(cont));
            builder().startBlock(br.getElseBlock());
            Reduction elseR = reduce(ite.getElseExpr(),
                    TraversalKind.TAIL,
                    thenR.state.withBlock(br.getElseBlock()).withContinuation(cont));
            TranslationState after = elseR.state.withContinuation(saved);

            if (saved != null) {
                // both arms already jumped to the continuation
                return new Reduction(null, after.withBlock(null));
            }
            builder().startBlock(cont);
            return new Reduction(cont.getArguments().get(0), after.withBlock(cont));
        }

        private Reduction reduceLet(Let let, TraversalKind k, TranslationState st) {
            VarDecl decl = let.getDecl();
            Reduction def = reduce(decl.getDefinition(), TraversalKind.DECL, st);
            VarDecl nvd = new VarDecl(decl.getName(), VarDecl.Kind.LET, def.value);
            enterScope(def.state, nvd);
            Reduction body = reduce(let.getBody(), k, def.state);
            exitScope(body.state, nvd);
            if (cfg != null) {
                return body;
            }
            return new Reduction(new Let(nvd, value(body, let)), body.state);
        }

        private Reduction reduceLetrec(Letrec letrec, TraversalKind k, TranslationState st) {
            VarDecl decl = letrec.getDecl();
            VarDecl nvd = new VarDecl(decl.getName(), VarDecl.Kind.LETREC, null);
            enterScope(st, nvd);
            Reduction def = reduce(decl.getDefinition(), TraversalKind.DECL, st);
            nvd.setDefinition(value(def, letrec));
            nameDefinition(def.state, nvd);
            Reduction body = reduce(letrec.getBody(), k, def.state);
            exitScope(body.state, nvd);
            if (cfg != null) {
                return body;
            }
            return new Reduction(new Letrec(nvd, value(body, letrec)), body.state);
        }

        private void enterScope(TranslationState st, VarDecl nvd) {
            if (nvd.getName().isEmpty()) return;
            st.scope.push(nvd);
            nameDefinition(st, nvd);
        }

        private void exitScope(TranslationState st, VarDecl nvd) {
            if (nvd.getName().isEmpty()) return;
            st.scope.pop(nvd);
        }

        private void nameDefinition(TranslationState st, VarDecl nvd) {
            if (st.block != null && nvd.getDefinition() instanceof Instruction) {
                Instruction insn = (Instruction) nvd.getDefinition();
                if (insn.getName().isEmpty()) {
                    insn.setName(nvd.getName());
                }
            }
        }

        private void drainPendingBlocks() {
            while (!queue.isEmpty()) {
                int pi = queue.poll();
                PendingBlock pb = pendingBlocks.get(pi);
                if (pb.getContinuation() == null || pb.isProcessed()) {
                    continue; // never called, or already lowered
                }
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("lowering pending block " + pi + " into " + pb.block.toTargetString());
                }
                builder().startBlock(pb.block);
                reduce(pb.body,
                        TraversalKind.TAIL,
                        new TranslationState(pb.block, pb.getContinuation(), pb.scope, Collections.emptyList()));
                if (builder().getBlock() != null) {
                    throw new IllegalStateException("never finished block " + pb.block.toTargetString());
                }
                pb.markProcessed();
            }
        }

        @NotNull
        private IRBuilder builder() {
            if (ib == null) {
                throw new IllegalStateException("not inside a CFG");
            }
            return ib;
        }
    }

    @NotNull
    private static SExpr value(Reduction r, SExpr of) {
        if (r.value == null) {
            throw new IllegalStateException("control leaves while lowering an operand of " + of.opcode().getName());
        }
        return r.value;
    }
}
