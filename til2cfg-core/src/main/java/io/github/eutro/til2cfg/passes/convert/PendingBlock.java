package io.github.eutro.til2cfg.passes.convert;

import io.github.eutro.til2cfg.diag.ReducerException;
import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.til.SExpr;
import org.jetbrains.annotations.Nullable;

/**
 * The body of a local function, waiting to be lowered into its block once a call to it is found.
 */
public class PendingBlock {
    public final SExpr body;
    public final BasicBlock block;
    /**
     * The scope the body is lowered in, with the function's parameters bound to the block's arguments.
     */
    public final VarContext scope;
    @Nullable
    private BasicBlock continuation;
    private boolean processed;

    public PendingBlock(SExpr body, BasicBlock block, VarContext scope) {
        this.body = body;
        this.block = block;
        this.scope = scope;
    }

    /**
     * Get where control goes once the body has a value, or null if the function was never called.
     *
     * @return The continuation.
     */
    @Nullable
    public BasicBlock getContinuation() {
        return continuation;
    }

    /**
     * Set the continuation, or check that it is the same as the one already set.
     * Every call of a local function must continue the same way, since they are all compiled to jumps.
     *
     * @param continuation The continuation of a call.
     */
    public void setContinuation(BasicBlock continuation) {
        if (this.continuation == null) {
            this.continuation = continuation;
        } else if (this.continuation != continuation) {
            throw ReducerException.continuationMismatch(block, this.continuation, continuation);
        }
    }

    public boolean isProcessed() {
        return processed;
    }

    public void markProcessed() {
        processed = true;
    }
}
