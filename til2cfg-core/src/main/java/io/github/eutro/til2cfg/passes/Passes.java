package io.github.eutro.til2cfg.passes;

import io.github.eutro.til2cfg.passes.meta.CheckNormalForm;
import io.github.eutro.til2cfg.passes.meta.ComputeNormalForm;
import io.github.eutro.til2cfg.ssa.SCFG;

public class Passes {
    /**
     * Bring a hand-built CFG into normal form, and check that the result is well-formed.
     */
    public static final IRPass<SCFG, SCFG> NORMALIZE =
            ComputeNormalForm.INSTANCE
                    .then(CheckNormalForm.INSTANCE);
}
