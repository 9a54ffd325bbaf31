package io.github.eutro.til2cfg.ext;

import io.github.eutro.til2cfg.passes.CFGPass;
import io.github.eutro.til2cfg.passes.meta.ComputeNormalForm;
import io.github.eutro.til2cfg.ssa.SCFG;

import java.util.BitSet;

/**
 * Tracks which derived data of an {@link SCFG} is still valid.
 * <p>
 * Structural edits (adding blocks, edges or terminators) call {@link #graphChanged()},
 * which drops everything computed from the shape of the graph.
 */
public class MetadataState {
    /**
     * One kind of derived data. Kinds are numbered as they are created, and compare by identity.
     */
    public static class MetaKind {
        private static int nextId = 0;

        private final int id;
        private final String name;

        private MetaKind(String name) {
            synchronized (MetaKind.class) {
                id = nextId++;
            }
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Derived data that a fixed pass can recompute on demand.
     */
    public static class ComputableMetaKind extends MetaKind {
        private final CFGPass pass;

        private ComputableMetaKind(String name, CFGPass pass) {
            super(name);
            this.pass = pass;
        }
    }

    /**
     * Blocks are topologically sorted, numbered, and carry dominator and post-dominator trees.
     */
    public static final ComputableMetaKind NORMAL_FORM =
            new ComputableMetaKind("NORMAL_FORM", ComputeNormalForm.INSTANCE);
    /**
     * The SSA-finalization pass has run.
     */
    public static final MetaKind SSA_FORM = new MetaKind("SSA_FORM");

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Recompute each of {@code kinds} that has gone stale.
     *
     * @param cfg   The CFG this state belongs to.
     * @param kinds The data to bring up to date.
     */
    public void ensureValid(SCFG cfg, ComputableMetaKind... kinds) {
        for (ComputableMetaKind kind : kinds) {
            if (!isValid(kind)) {
                kind.pass.runOn(cfg);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
        }
    }

    public void graphChanged() {
        invalidate(NORMAL_FORM, SSA_FORM);
    }
}
