package io.github.eutro.til2cfg.til;

import org.jetbrains.annotations.Nullable;

/**
 * A block of code: the body of a function.
 * <p>
 * After lowering, the body of a top-level code block is its {@link io.github.eutro.til2cfg.ssa.SCFG},
 * and the body of a local one is the {@link io.github.eutro.til2cfg.ssa.BasicBlock} it became.
 */
public final class Code extends SExpr {
    @Nullable
    private final SExpr returnType;
    @Nullable
    private final SExpr body;

    public Code(@Nullable SExpr returnType, @Nullable SExpr body) {
        super(Opcode.CODE);
        this.returnType = returnType;
        this.body = body;
    }

    @Nullable
    public SExpr getReturnType() {
        return returnType;
    }

    @Nullable
    public SExpr getBody() {
        return body;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("code");
        if (returnType != null) {
            sb.append(" : ").append(returnType);
        }
        if (body instanceof io.github.eutro.til2cfg.ssa.BasicBlock) {
            sb.append(" -> ").append(((io.github.eutro.til2cfg.ssa.BasicBlock) body).toTargetString());
        } else {
            sb.append(" { ").append(operandString(body)).append(" }");
        }
        return sb.toString();
    }
}
