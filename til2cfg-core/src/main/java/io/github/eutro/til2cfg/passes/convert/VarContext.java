package io.github.eutro.til2cfg.passes.convert;

import io.github.eutro.til2cfg.til.VarDecl;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The variables in scope, innermost last.
 * <p>
 * Indices passed to {@link #get(int)} and {@link #set(int, VarDecl)} count from the innermost variable, at 0.
 */
public class VarContext {
    private final List<VarDecl> vars;

    public VarContext() {
        this(new ArrayList<>());
    }

    private VarContext(List<VarDecl> vars) {
        this.vars = vars;
    }

    public void push(@NotNull VarDecl decl) {
        vars.add(decl);
    }

    /**
     * Remove the innermost variable, which must have the same name as {@code expected}.
     *
     * @param expected The variable the caller is leaving the scope of.
     */
    public void pop(VarDecl expected) {
        if (vars.isEmpty()) {
            throw new IllegalStateException("variable mismatch: popping " + expected.getName() + " from an empty scope");
        }
        VarDecl top = vars.get(vars.size() - 1);
        if (!top.getName().equals(expected.getName())) {
            throw new IllegalStateException("variable mismatch: popping " + expected.getName() + " but " + top.getName() + " is innermost");
        }
        vars.remove(vars.size() - 1);
    }

    /**
     * Find the innermost variable named {@code name}.
     *
     * @param name The name.
     * @return The variable, or empty if none is in scope.
     */
    public Optional<VarDecl> lookup(String name) {
        for (int i = vars.size() - 1; i >= 0; i--) {
            VarDecl vd = vars.get(i);
            if (vd.getName().equals(name)) {
                return Optional.of(vd);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return vars.size();
    }

    public VarDecl get(int i) {
        return vars.get(vars.size() - 1 - i);
    }

    public void set(int i, @NotNull VarDecl decl) {
        vars.set(vars.size() - 1 - i, decl);
    }

    /**
     * Copy this scope. The copy shares the declarations, but not the stack.
     *
     * @return The copy.
     */
    @Override
    public VarContext clone() {
        return new VarContext(new ArrayList<>(vars));
    }

    @Override
    public String toString() {
        return vars.toString();
    }
}
