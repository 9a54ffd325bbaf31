package io.github.eutro.til2cfg.diag;

import io.github.eutro.til2cfg.ssa.BasicBlock;

/**
 * Thrown when lowering breaks a structural rule of the control-flow graph.
 * <p>
 * These are not errors in the user's program, but in how the expression was
 * shaped for lowering, so callers decide whether to abort or report them.
 */
public class ReducerException extends RuntimeException {
    public enum Kind {
        /**
         * A local function was called from two places that continue differently,
         * so its calls cannot all be compiled as jumps.
         */
        CONTINUATION_MISMATCH,
        /**
         * A jump passed a different number of values than its target takes.
         */
        ARITY_MISMATCH,
        /**
         * Some blocks cannot reach the exit, or cannot be reached from the entry.
         */
        UNREACHABLE_BLOCKS,
    }

    private final Kind kind;

    public ReducerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static ReducerException continuationMismatch(BasicBlock target, BasicBlock expected, BasicBlock actual) {
        return new ReducerException(Kind.CONTINUATION_MISMATCH,
                String.format("cannot express call to %s as a tail call: continues to %s, but previously to %s",
                        target.toTargetString(),
                        actual.toTargetString(),
                        expected.toTargetString()));
    }

    public static ReducerException arityMismatch(BasicBlock target, int expected, int actual) {
        return new ReducerException(Kind.ARITY_MISMATCH,
                String.format("jump to %s passes %d values, but it takes %d",
                        target.toTargetString(),
                        actual,
                        expected));
    }

    public static ReducerException unreachableBlocks(int count, String from) {
        return new ReducerException(Kind.UNREACHABLE_BLOCKS,
                String.format("%d block(s) not connected to the %s", count, from));
    }
}
