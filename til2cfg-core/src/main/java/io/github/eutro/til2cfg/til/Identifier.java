package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A name, as written in the source, not yet resolved to a declaration.
 */
public final class Identifier extends SExpr {
    private final String name;

    public Identifier(@NotNull String name) {
        super(Opcode.IDENTIFIER);
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
