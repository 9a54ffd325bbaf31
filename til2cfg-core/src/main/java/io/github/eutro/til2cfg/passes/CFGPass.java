package io.github.eutro.til2cfg.passes;

import io.github.eutro.til2cfg.ssa.SCFG;

/**
 * A pass that edits or inspects an {@link SCFG} without replacing it.
 */
@FunctionalInterface
public interface CFGPass extends IRPass<SCFG, SCFG> {
    /**
     * Run the pass on {@code cfg}.
     *
     * @param cfg The CFG.
     */
    void runOn(SCFG cfg);

    @Override
    default SCFG run(SCFG cfg) {
        runOn(cfg);
        return cfg;
    }
}
