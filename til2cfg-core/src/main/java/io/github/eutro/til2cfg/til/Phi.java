package io.github.eutro.til2cfg.til;

import java.util.ArrayList;
import java.util.List;

/**
 * A block argument, whose value depends on the edge control came in from.
 * <p>
 * There is one value slot per predecessor of the owning block, in the order
 * the predecessors were added. A slot is {@code null} until the jump along that edge fills it in.
 */
public final class Phi extends Instruction {
    private final ArrayList<SExpr> values = new ArrayList<>();

    public Phi() {
        super(Opcode.PHI);
    }

    public List<SExpr> values() {
        return values;
    }

    public void reserve(int n) {
        values.ensureCapacity(n);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("phi(");
        boolean first = true;
        for (SExpr value : values) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(operandString(value));
        }
        return sb.append(')').toString();
    }
}
