package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.Nullable;

/**
 * A constant value.
 */
public final class Literal extends Instruction {
    @Nullable
    private final Object value;

    public Literal(@Nullable Object value) {
        super(Opcode.LITERAL);
        this.value = value;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        if (value instanceof String) {
            return '"' + (String) value + '"';
        }
        return String.valueOf(value);
    }
}
