package io.github.eutro.til2cfg.til;

/**
 * The position a sub-expression is visited in.
 */
public enum TraversalKind {
    /**
     * An ordinary operand.
     */
    NORMAL,
    /**
     * The definition of a binding.
     */
    DECL,
    /**
     * The result of the enclosing function or branch arm; control continues
     * at the current continuation once it is produced.
     */
    TAIL,
}
