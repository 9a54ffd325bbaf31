package io.github.eutro.til2cfg.passes.convert;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.til.SExpr;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Where lowering is at: the open block, where control goes after the current expression,
 * the variables in scope, and the arguments applied so far to the function being called.
 * <p>
 * Instances are immutable; the {@code with} methods return updated copies.
 * The scope itself is shared, and pushed and popped in a balanced way.
 */
public final class TranslationState {
    @Nullable
    public final BasicBlock block;
    @Nullable
    public final BasicBlock continuation;
    public final VarContext scope;
    public final List<SExpr> pendingArgs;

    public TranslationState(
            @Nullable BasicBlock block,
            @Nullable BasicBlock continuation,
            @NotNull VarContext scope,
            @NotNull List<SExpr> pendingArgs
    ) {
        this.block = block;
        this.continuation = continuation;
        this.scope = scope;
        this.pendingArgs = pendingArgs;
    }

    public static TranslationState initial(VarContext scope) {
        return new TranslationState(null, null, scope, Collections.emptyList());
    }

    public TranslationState withBlock(@Nullable BasicBlock block) {
        return new TranslationState(block, continuation, scope, pendingArgs);
    }

    public TranslationState withContinuation(@Nullable BasicBlock continuation) {
        return new TranslationState(block, continuation, scope, pendingArgs);
    }

    public TranslationState withPendingArgs(List<SExpr> pendingArgs) {
        return new TranslationState(block, continuation, scope, pendingArgs);
    }

    public TranslationState pushArg(SExpr arg) {
        List<SExpr> args = new ArrayList<>(pendingArgs.size() + 1);
        args.addAll(pendingArgs);
        args.add(arg);
        return withPendingArgs(Collections.unmodifiableList(args));
    }
}
