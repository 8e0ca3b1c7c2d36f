package io.github.qsafe.core.passes.meta;

import io.github.qsafe.core.StructuralViolationException;
import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ops.QuantumOps;
import io.github.qsafe.core.passes.InPlaceIRPass;
import io.github.qsafe.core.reg.DependencyDag;
import io.github.qsafe.core.reg.RegisterRef;
import io.github.qsafe.core.reg.RegisterTimeline;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Function;
import io.github.qsafe.core.ssa.Insn;
import io.github.qsafe.core.ssa.Var;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a quantum-safe function respects every register constraint: writes are
 * in place, each version is produced once, no operation reads the same version twice,
 * and no version is read after it is overwritten.
 * <p>
 * Analyses are computed afresh, not taken from the function's exts.
 */
public class VerifyConstraints implements InPlaceIRPass<Function> {
    public static final VerifyConstraints INSTANCE = new VerifyConstraints();

    @Override
    public void runInPlace(Function func) {
        List<String> violations = findViolations(func);
        if (!violations.isEmpty()) {
            throw new StructuralViolationException(violations.size() + " constraint violation(s): "
                    + String.join("; ", violations));
        }
    }

    /**
     * Find every constraint violation in a function.
     *
     * @param func The function.
     * @return A description of each violation, in program order.
     */
    public static List<String> findViolations(Function func) {
        BasicBlock block = StraightLine.blockOf(func);
        DependencyDag dag = DependencyDag.build(block.getEffects(), block.getControl().insn());
        RegisterTimeline timeline = RegisterTimeline.compute(dag);

        List<String> violations = new ArrayList<>();
        Set<RegisterRef> produced = new HashSet<>();
        for (DependencyDag.Node node : dag.getNodes()) {
            Insn insn = node.insn;
            for (Var result : node.effect.getAssignsTo()) {
                RegisterRef ref = result.getExtOrThrow(CommonExts.REGISTER);
                if (!produced.add(ref)) {
                    violations.add(node + ": " + ref + " is produced more than once");
                }
            }
            if (QuantumOps.isInPlace(insn)) {
                RegisterRef lhs = insn.args().get(0).getExtOrThrow(CommonExts.REGISTER);
                RegisterRef res = node.effect.result().getExtOrThrow(CommonExts.REGISTER);
                if (res.registerId != lhs.registerId || res.version != lhs.version + 1) {
                    violations.add(node + ": writes " + res + " instead of " + lhs.next());
                }
            }
            if (QuantumOps.hasTwoOperands(insn)
                    && insn.args().get(0).getExtOrThrow(CommonExts.REGISTER)
                    .equals(insn.args().get(1).getExtOrThrow(CommonExts.REGISTER))) {
                violations.add(node + ": reads " + insn.args().get(0).getExtOrThrow(CommonExts.REGISTER) + " twice");
            }
            checkReads(node, timeline, violations);
        }
        checkReads(dag.getReturnNode(), timeline, violations);
        return violations;
    }

    private static void checkReads(DependencyDag.Node node, RegisterTimeline timeline, List<String> violations) {
        List<Var> args = node.insn.args();
        boolean inPlace = QuantumOps.isInPlace(node.insn);
        for (int i = 0; i < args.size(); i++) {
            RegisterRef ref = args.get(i).getExtOrThrow(CommonExts.REGISTER);
            boolean consuming = inPlace && i == 0;
            if (!timeline.isValidRead(ref, node.index, consuming)) {
                String reason;
                int producedAt = timeline.producedAt(ref);
                if (producedAt < 0 || producedAt >= node.index) {
                    reason = "it is not produced before";
                } else if (consuming && node.index != timeline.nextOverwrite(ref)) {
                    reason = "the next version is produced at " + timeline.nextOverwrite(ref);
                } else {
                    reason = "it is overwritten at " + timeline.nextOverwrite(ref);
                }
                violations.add(node + ": " + (consuming ? "consumes " : "reads ") + ref + " but " + reason);
            }
        }
    }
}
