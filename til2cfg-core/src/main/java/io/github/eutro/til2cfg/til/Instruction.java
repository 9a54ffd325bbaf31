package io.github.eutro.til2cfg.til;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An expression which can be placed in a {@link BasicBlock}.
 * <p>
 * Once placed, the instruction is stamped with its block, and numbered
 * when the enclosing CFG is renumbered.
 */
public abstract class Instruction extends SExpr {
    public static final boolean TRACK_INSN_CREATIONS = System.getenv("TIL2CFG_TRACK_INSN_CREATIONS") != null;

    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;

    @Nullable
    private BasicBlock block;
    private int instrID;
    private String name = "";

    protected Instruction(Opcode opcode) {
        super(opcode);
    }

    @Nullable
    public BasicBlock getBlock() {
        return block;
    }

    public void setBlock(@Nullable BasicBlock block) {
        this.block = block;
    }

    /**
     * Get the id of this instruction, unique within its CFG after renumbering. 0 means unnumbered.
     *
     * @return The id.
     */
    public int getInstrID() {
        return instrID;
    }

    public void setInstrID(int instrID) {
        this.instrID = instrID;
    }

    @NotNull
    public String getName() {
        return name;
    }

    public void setName(@NotNull String name) {
        this.name = name;
    }

    /**
     * Get the string used when another node refers to this one.
     *
     * @return The reference string.
     */
    public String toRefString() {
        return '%' + (name.isEmpty() ? "t" : name) + "." + instrID;
    }
}
