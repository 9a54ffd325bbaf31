package io.github.eutro.til2cfg.passes.convert;

import io.github.eutro.til2cfg.til.SExpr;
import org.jetbrains.annotations.Nullable;

/**
 * The result of lowering one expression: its value, and the state lowering continues in.
 * <p>
 * The value is null when control left through a jump, and there is no value to continue with.
 */
public final class Reduction {
    @Nullable
    public final SExpr value;
    public final TranslationState state;

    public Reduction(@Nullable SExpr value, TranslationState state) {
        this.value = value;
        this.state = state;
    }
}
