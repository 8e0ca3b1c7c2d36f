package io.github.qsafe.core.passes.meta;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.passes.InPlaceIRPass;
import io.github.qsafe.core.reg.DependencyDag;
import io.github.qsafe.core.reg.RegisterTimeline;
import io.github.qsafe.core.ssa.Function;

/**
 * Computes {@link CommonExts#REGISTER_TIMELINE} for a quantum-safe function,
 * building its {@link CommonExts#DEPENDENCY_DAG} first if needed.
 */
public class ComputeTimelines implements InPlaceIRPass<Function> {
    public static final ComputeTimelines INSTANCE = new ComputeTimelines();

    @Override
    public void runInPlace(Function func) {
        DependencyDag dag = func.getExtOrRun(CommonExts.DEPENDENCY_DAG, func, BuildDependencyDag.INSTANCE);
        func.attachExt(CommonExts.REGISTER_TIMELINE, RegisterTimeline.compute(dag));
    }
}
