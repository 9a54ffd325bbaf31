package io.github.eutro.til2cfg.ext;

import io.github.eutro.til2cfg.ssa.BasicBlock;
import io.github.eutro.til2cfg.ssa.SCFG;
import io.github.eutro.til2cfg.til.Identifier;

/**
 * The {@link Ext}s used by the lowering and normalization passes.
 */
public class CommonExts {
    /**
     * Attached to an {@link SCFG}. Which of its derived data is up to date.
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The {@link SCFG} whose block list contains it.
     */
    public static final Ext<SCFG> OWNING_CFG = Ext.create(SCFG.class, "OWNING_CFG");

    /**
     * Attached to an {@link Identifier} the reducer could not resolve, and left in place of a value.
     */
    public static final Ext<Boolean> UNRESOLVED = Ext.create(Boolean.class, "UNRESOLVED");

    /**
     * Check whether the given node is a placeholder for an unresolved name.
     *
     * @param ec The node.
     * @return Whether it was marked {@link #UNRESOLVED}.
     */
    public static boolean isUnresolved(ExtContainer ec) {
        return Boolean.TRUE.equals(ec.getNullable(UNRESOLVED));
    }
}
