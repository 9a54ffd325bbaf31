package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Projects a named slot out of a record.
 */
public final class Project extends Instruction {
    private final SExpr record;
    private final String slotName;

    public Project(@NotNull SExpr record, @NotNull String slotName) {
        super(Opcode.PROJECT);
        this.record = Objects.requireNonNull(record);
        this.slotName = Objects.requireNonNull(slotName);
    }

    public SExpr getRecord() {
        return record;
    }

    public String getSlotName() {
        return slotName;
    }

    @Override
    public String toString() {
        return operandString(record) + "." + slotName;
    }
}
