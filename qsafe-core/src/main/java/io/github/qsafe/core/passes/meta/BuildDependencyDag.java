package io.github.qsafe.core.passes.meta;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.passes.InPlaceIRPass;
import io.github.qsafe.core.reg.DependencyDag;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Function;

/**
 * Computes {@link CommonExts#DEPENDENCY_DAG} for a quantum-safe function.
 */
public class BuildDependencyDag implements InPlaceIRPass<Function> {
    public static final BuildDependencyDag INSTANCE = new BuildDependencyDag();

    @Override
    public void runInPlace(Function func) {
        BasicBlock block = StraightLine.blockOf(func);
        func.attachExt(CommonExts.DEPENDENCY_DAG, DependencyDag.build(block.getEffects(), block.getControl().insn()));
    }
}
