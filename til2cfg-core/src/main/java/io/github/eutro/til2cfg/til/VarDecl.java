package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ext.ExtHolder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A variable declaration: a name, how it was bound, and what it is bound to.
 */
public final class VarDecl extends ExtHolder {
    public enum Kind {
        /**
         * Bound by {@link Let}.
         */
        LET,
        /**
         * Bound by {@link Letrec}, and in scope in its own definition.
         */
        LETREC,
        /**
         * A {@link Function} parameter. Has no definition.
         */
        FUN,
    }

    private final String name;
    private final Kind kind;
    @Nullable
    private SExpr definition;

    public VarDecl(@NotNull String name, @NotNull Kind kind, @Nullable SExpr definition) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.definition = definition;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    @Nullable
    public SExpr getDefinition() {
        return definition;
    }

    /**
     * Tie the knot of a {@link Kind#LETREC} declaration, whose definition
     * can only be built after the declaration is in scope.
     *
     * @param definition The definition.
     */
    public void setDefinition(@NotNull SExpr definition) {
        if (kind != Kind.LETREC) {
            throw new IllegalStateException("only letrec declarations are patched, not " + kind);
        }
        if (this.definition != null) {
            throw new IllegalStateException("definition of " + name + " already set");
        }
        this.definition = Objects.requireNonNull(definition);
    }

    @Override
    public String toString() {
        return name;
    }
}
