package io.github.eutro.til2cfg.til;

/**
 * The kinds of {@link SExpr}. The set is closed: every node class reports exactly one of these.
 */
public enum Opcode {
    LITERAL("Literal"),
    IDENTIFIER("Identifier"),
    VARIABLE("Variable"),
    FUNCTION("Function"),
    CODE("Code"),
    APPLY("Apply"),
    CALL("Call"),
    PROJECT("Project"),
    UNARY_OP("UnaryOp"),
    BINARY_OP("BinaryOp"),
    IF_THEN_ELSE("IfThenElse"),
    LET("Let"),
    LETREC("Letrec"),
    PHI("Phi"),
    GOTO("Goto"),
    BRANCH("Branch"),
    RETURN("Return"),
    BASIC_BLOCK("BasicBlock"),
    SCFG("SCFG");

    private final String name;

    Opcode(String name) {
        this.name = name;
    }

    /**
     * Get the display name of this opcode.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Whether nodes of this kind are values which are referenced in place,
     * and never appear in a block's instruction list.
     *
     * @return The above.
     */
    public boolean isInlineable() {
        switch (this) {
            case LITERAL:
            case VARIABLE:
            case APPLY:
            case PROJECT:
                return true;
            default:
                return false;
        }
    }
}
