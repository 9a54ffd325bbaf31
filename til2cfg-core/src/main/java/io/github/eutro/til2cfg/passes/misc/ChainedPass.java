package io.github.eutro.til2cfg.passes.misc;

import io.github.eutro.til2cfg.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of passes, each fed the result of the one before.
 * <p>
 * Chains of chains are flattened, so a failure names its position in the whole sequence.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public final class ChainedPass<A, B> implements IRPass<A, B> {
    private final List<IRPass<Object, Object>> passes;

    private ChainedPass(List<IRPass<Object, Object>> passes) {
        this.passes = Collections.unmodifiableList(passes);
    }

    /**
     * Run {@code first}, then {@code next} on its result.
     *
     * @param first The first pass.
     * @param next  The pass after it.
     * @param <A>   The input type.
     * @param <B>   The intermediate type.
     * @param <C>   The output type.
     * @return The chain.
     */
    public static <A, B, C> ChainedPass<A, C> of(IRPass<A, B> first, IRPass<B, C> next) {
        List<IRPass<Object, Object>> passes = new ArrayList<>();
        flattenInto(passes, first);
        flattenInto(passes, next);
        return new ChainedPass<>(passes);
    }

    @SuppressWarnings("unchecked")
    private static void flattenInto(List<IRPass<Object, Object>> passes, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?>) pass).passes);
        } else {
            passes.add((IRPass<Object, Object>) pass);
        }
    }

    public List<IRPass<Object, Object>> getPasses() {
        return passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public B run(A a) {
        Object value = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            try {
                value = pass.run(value);
            } catch (RuntimeException e) {
                e.addSuppressed(new IllegalStateException("in pass " + (i + 1) + " of " + passes.size() + ": " + pass));
                throw e;
            }
        }
        return (B) value;
    }
}
