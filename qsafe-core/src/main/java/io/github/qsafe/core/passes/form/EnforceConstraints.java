package io.github.qsafe.core.passes.form;

import io.github.qsafe.core.UndefinedValueException;
import io.github.qsafe.core.UnsupportedOpException;
import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ops.QuantumOps;
import io.github.qsafe.core.passes.InPlaceIRPass;
import io.github.qsafe.core.passes.meta.BuildDependencyDag;
import io.github.qsafe.core.passes.meta.ComputeTimelines;
import io.github.qsafe.core.passes.meta.StraightLine;
import io.github.qsafe.core.reg.*;
import io.github.qsafe.core.ssa.*;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Rewrites a straight-line quantum-safe function so that every register constraint holds.
 * <p>
 * The function is walked in order, keeping the register versions that are still available:
 * produced, not yet overwritten, and read again later. An operand that is no longer
 * available is recomputed by cloning its producing instructions, recursively, into
 * fresh registers just before it is needed. An operation that would read the same
 * version twice reads a clone on the right instead. Clones of in-place operations
 * still write in place, to their cloned left operand. Controls are never overwritten,
 * so are shared by clones.
 * <p>
 * Code that already respects every constraint is left as it is.
 */
public class EnforceConstraints implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = Logger.getLogger(EnforceConstraints.class);

    public static final EnforceConstraints INSTANCE = new EnforceConstraints();

    @Override
    public void runInPlace(Function func) {
        BasicBlock block = StraightLine.blockOf(func);
        DependencyDag dag = func.getExtOrRun(CommonExts.DEPENDENCY_DAG, func, BuildDependencyDag.INSTANCE);
        RegisterTimeline timeline = func.getExtOrRun(CommonExts.REGISTER_TIMELINE, func, ComputeTimelines.INSTANCE);
        RegisterAllocator alloc = RegisterAllocator.after(func);

        block.clearEffects();
        Rewriter rw = new Rewriter(dag, timeline, new RegisterBuilder(new IRBuilder(func, block), alloc));
        for (DependencyDag.Node node : dag.getNodes()) {
            rw.rewrite(node);
        }
        DependencyDag.Node ret = dag.getReturnNode();
        List<Var> retArgs = new ArrayList<>();
        for (Var arg : ret.insn) {
            retArgs.add(rw.resolve(arg, false));
        }
        block.setControl(Control.ret(retArgs.toArray(new Var[0])));

        func.removeExt(CommonExts.DEPENDENCY_DAG);
        func.removeExt(CommonExts.REGISTER_TIMELINE);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("enforced constraints with " + rw.clones + " cloned instruction(s)");
        }
    }

    private static final class Rewriter {
        final DependencyDag dag;
        final RegisterTimeline timeline;
        final RegisterBuilder rb;
        final RegisterAllocator alloc;

        /**
         * Original version, to the rewritten value currently holding it.
         */
        final Map<RegisterRef, Var> available = new HashMap<>();
        /**
         * Rewritten register id, to the original versions bound to values in it.
         */
        final Map<Integer, Set<RegisterRef>> bound = new HashMap<>();
        int clones = 0;

        Rewriter(DependencyDag dag, RegisterTimeline timeline, RegisterBuilder rb) {
            this.dag = dag;
            this.timeline = timeline;
            this.rb = rb;
            this.alloc = rb.getAllocator();
        }

        void rewrite(DependencyDag.Node node) {
            Insn insn = node.insn;
            Var result = node.effect.result();
            boolean inPlace = QuantumOps.isInPlace(insn);
            List<Var> args = insn.args();
            List<Var> newArgs = new ArrayList<>(args.size());
            for (int i = 0; i < args.size(); i++) {
                newArgs.add(resolve(args.get(i), inPlace && i == 0));
            }
            separateOperands(insn, args, newArgs);

            RegisterRef ref = result.register();
            Var newResult = result;
            if (inPlace) {
                RegisterRef next = newArgs.get(0).register().next();
                if (!next.equals(ref)) newResult = rb.newValue(next);
            } else if (alloc.isProduced(ref)) {
                newResult = rb.newValue(alloc.fresh(ref.width, clonePath(ref)));
            }
            rb.insert(insn.op.insn(newArgs), newResult);
            if (newResult != result) {
                copyDefinition(result, newResult);
            }
            bind(ref, newResult);

            for (Var arg : args) {
                RegisterRef argRef = arg.register();
                if (timeline.lastUse(argRef) <= node.index) {
                    unbind(argRef);
                }
            }
        }

        /**
         * Get a rewritten value holding an original one, cloning it if it is no longer available.
         */
        Var resolve(Var original, boolean consuming) {
            Var var = available.get(original.register());
            if (var != null) {
                return var;
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug((consuming ? "consuming " : "reading ") + original
                        + " after it was overwritten, recomputing it");
            }
            return cloneRec(original);
        }

        void separateOperands(Insn insn, List<Var> args, List<Var> newArgs) {
            if (QuantumOps.hasTwoOperands(insn)
                    && newArgs.get(0).register().equals(newArgs.get(1).register())) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(insn + " reads " + newArgs.get(0) + " twice, cloning the right operand");
                }
                newArgs.set(1, cloneRec(args.get(1)));
            }
        }

        /**
         * Recompute an original value into fresh registers, from its producing instruction.
         */
        Var cloneRec(Var original) {
            DependencyDag.Node node = dag.producerOf(original);
            if (node == null) {
                throw new UndefinedValueException(original + " has no producer");
            }
            Insn insn = node.insn;
            RegisterRef ref = original.register();
            List<Var> args = insn.args();
            List<Var> newArgs = new ArrayList<>(args.size());
            Var clone;
            if (QuantumOps.isInPlace(insn)) {
                newArgs.add(cloneRec(args.get(0)));
                for (int i = 1; i < args.size(); i++) {
                    newArgs.add(resolve(args.get(i), false));
                }
                separateOperands(insn, args, newArgs);
                clone = rb.newValue(newArgs.get(0).register().next());
            } else if (insn.op.key == QuantumOps.INIT
                    || insn.op.key == QuantumOps.CMP
                    || insn.op.key == QuantumOps.AND.key
                    || insn.op.key == QuantumOps.OR.key
                    || insn.op.key == QuantumOps.NOT.key) {
                for (Var arg : args) {
                    newArgs.add(resolve(arg, false));
                }
                separateOperands(insn, args, newArgs);
                clone = rb.newValue(alloc.fresh(ref.width, clonePath(ref)));
            } else {
                throw new UnsupportedOpException("cannot recompute " + original + " from " + insn);
            }
            rb.insert(insn.op.insn(newArgs), clone);
            copyDefinition(original, clone);
            bind(ref, clone);
            clones++;
            return clone;
        }

        void bind(RegisterRef original, Var var) {
            unbind(original);
            RegisterRef ref = var.register();
            Set<RegisterRef> inRegister = bound.computeIfAbsent(ref.registerId, k -> new HashSet<>());
            // older versions of the register are gone
            inRegister.removeIf(held -> {
                if (available.get(held).register().version < ref.version) {
                    available.remove(held);
                    return true;
                }
                return false;
            });
            available.put(original, var);
            inRegister.add(original);
        }

        void unbind(RegisterRef original) {
            Var var = available.remove(original);
            if (var != null) {
                bound.get(var.register().registerId).remove(original);
            }
        }

        static String clonePath(RegisterRef ref) {
            return "c" + ref.registerId + "." + ref.version;
        }

        static void copyDefinition(Var from, Var to) {
            Expr def = from.getNullable(CommonExts.DEFINITION);
            if (def != null) to.attachExt(CommonExts.DEFINITION, def);
        }
    }
}
