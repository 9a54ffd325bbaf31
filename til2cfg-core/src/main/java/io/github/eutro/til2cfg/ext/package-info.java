/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.til2cfg.ext.ExtContainer}.
 *
 * <pre>{@code
 * class BlockExts {
 *   public static final Ext<Integer> LOOP_DEPTH = Ext.create(Integer.class, "loopDepth");
 * }
 *
 * block.attachExt(LOOP_DEPTH, 2);
 * block.getExtOrThrow(LOOP_DEPTH); // => 2
 * }</pre>
 * <p>
 * Passes use this to hang scratch or derived data off the IR without
 * widening every node class. Specialised containers, like
 * {@link io.github.eutro.til2cfg.ssa.BasicBlock} and
 * {@link io.github.eutro.til2cfg.ssa.SCFG}, store their hot exts in fields.
 */
package io.github.eutro.til2cfg.ext;
