package io.github.eutro.til2cfg.passes;

import io.github.eutro.til2cfg.passes.misc.ChainedPass;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.til.SExpr;

/**
 * A pass to run on some part of the IR (e.g. an {@link SExpr} tree, or an {@link SCFG}),
 * which may modify the IR, or convert it to a different form.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return ChainedPass.of(this, next);
    }
}
