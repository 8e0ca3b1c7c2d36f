package io.github.qsafe.core.passes.convert;

import io.github.qsafe.core.DivisionByZeroException;
import io.github.qsafe.core.UndefinedValueException;
import io.github.qsafe.core.UnsupportedOpException;
import io.github.qsafe.core.conf.CompilerConfig;
import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ops.*;
import io.github.qsafe.core.passes.IRPass;
import io.github.qsafe.core.passes.meta.ComputePreds;
import io.github.qsafe.core.reg.Expr;
import io.github.qsafe.core.reg.RegisterAllocator;
import io.github.qsafe.core.reg.RegisterBuilder;
import io.github.qsafe.core.ssa.*;
import io.github.qsafe.core.util.Pair;
import io.github.qsafe.core.util.TwosComplement;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Translates a classical function into a straight-line quantum-safe function.
 * <p>
 * Conditionals are linearised: both arms are translated, one after the other, with every
 * in-place operation controlled on the conjunction of the enclosing branch conditions,
 * and each phi becomes a sum of its incoming values, each controlled on its edge.
 * <p>
 * Every in-place operation overwrites its left operand. A value whose register has been
 * overwritten is recomputed from its {@link Expr defining expression} into fresh registers
 * when it is next needed, and an operation reading the same version twice reads a fresh
 * duplicate on the right instead.
 * <p>
 * The result carries {@link CommonExts#VALUE_MAP}, mapping each classical value to the
 * quantum-safe value that last held it.
 */
public class ClassicalToQuantum implements IRPass<Function, Function> {
    private static final Logger LOGGER = Logger.getLogger(ClassicalToQuantum.class);

    private final CompilerConfig config;

    public ClassicalToQuantum(CompilerConfig config) {
        this.config = config;
    }

    @Override
    public Function run(Function func) {
        Map<BasicBlock, List<BasicBlock>> preds = ComputePreds.INSTANCE.run(func);
        Function out = new Function();
        out.attachExt(CommonExts.CODE_TYPE, CommonExts.CodeType.QUANTUM);
        Ctx ctx = new Ctx(config.getBitWidth(), preds,
                new RegisterBuilder(new IRBuilder(out, out.newBb()), new RegisterAllocator()));
        ctx.translateRegion(func.getEntry(), null);
        out.attachExt(CommonExts.VALUE_MAP, ctx.valueMap());
        for (BasicBlock block : func.getBlocks()) {
            if (!ctx.visited.contains(block) && LOGGER.isDebugEnabled()) {
                LOGGER.debug("skipped unreachable block " + block.toTargetString());
            }
        }
        return out;
    }

    private static final class Ctx {
        final int width;
        final Map<BasicBlock, List<BasicBlock>> preds;
        final RegisterBuilder rb;
        final Set<BasicBlock> visited = new HashSet<>();

        final Map<Var, Expr> ints = new HashMap<>();
        final Map<Expr, Var> live = new IdentityHashMap<>();
        final Map<Var, Var> bools = new HashMap<>();

        final List<Var> conds = new ArrayList<>();
        final List<Var> folds = new ArrayList<>();
        final Map<Pair<BasicBlock, BasicBlock>, Var> edgeControls = new HashMap<>();

        Ctx(int width, Map<BasicBlock, List<BasicBlock>> preds, RegisterBuilder rb) {
            this.width = width;
            this.preds = preds;
            this.rb = rb;
        }

        void translateRegion(BasicBlock start, @Nullable BasicBlock stop) {
            BasicBlock bb = start;
            while (bb != stop) {
                if (bb == null) {
                    throw new UnsupportedOpException("conditional arms never rejoin before " + stop.toTargetString());
                }
                if (!visited.add(bb)) {
                    throw new UnsupportedOpException("control flow reaches " + bb.toTargetString()
                            + " twice, loops must be unrolled");
                }
                for (Effect effect : bb.getEffects()) {
                    translateEffect(effect);
                }
                Control ctrl = bb.getControl();
                OpKey key = ctrl.insn().op.key;
                if (key == CommonOps.RETURN.key) {
                    if (!conds.isEmpty()) {
                        throw new UnsupportedOpException("return from " + bb.toTargetString() + " inside a conditional");
                    }
                    translateReturn(ctrl.insn());
                    return;
                } else if (key == CommonOps.BR.key) {
                    BasicBlock target = ctrl.targets.get(0);
                    edgeControls.put(Pair.of(bb, target), control());
                    bb = target;
                } else if (key == ClassicalOps.COND_BR.key) {
                    bb = translateCondBr(bb, ctrl);
                } else {
                    throw new UnsupportedOpException("control op " + ctrl.insn().op + " is not supported");
                }
            }
        }

        BasicBlock translateCondBr(BasicBlock bb, Control ctrl) {
            BasicBlock ifTrue = ctrl.targets.get(0);
            BasicBlock ifFalse = ctrl.targets.get(1);
            if (ifTrue == ifFalse) {
                edgeControls.put(Pair.of(bb, ifTrue), control());
                return ifTrue;
            }
            BasicBlock join = findJoin(ifTrue, ifFalse);
            if (join == null) {
                throw new UnsupportedOpException("arms of the branch in " + bb.toTargetString() + " never rejoin");
            }
            Var cond = bool(ctrl.insn().args().get(0));

            push(cond);
            enterArm(bb, ifTrue, join);
            pop();

            push(rb.not(cond));
            enterArm(bb, ifFalse, join);
            pop();
            return join;
        }

        void enterArm(BasicBlock from, BasicBlock arm, BasicBlock join) {
            if (arm == join) {
                edgeControls.put(Pair.of(from, join), control());
            } else {
                translateRegion(arm, join);
            }
        }

        /**
         * The nearest block, from the false arm, that both arms reach.
         */
        @Nullable
        static BasicBlock findJoin(BasicBlock ifTrue, BasicBlock ifFalse) {
            Set<BasicBlock> fromTrue = new HashSet<>();
            Deque<BasicBlock> queue = new ArrayDeque<>();
            queue.add(ifTrue);
            while (!queue.isEmpty()) {
                BasicBlock next = queue.remove();
                if (fromTrue.add(next)) queue.addAll(next.getControl().targets);
            }
            Set<BasicBlock> seen = new HashSet<>();
            queue.add(ifFalse);
            while (!queue.isEmpty()) {
                BasicBlock next = queue.remove();
                if (!seen.add(next)) continue;
                if (fromTrue.contains(next)) return next;
                queue.addAll(next.getControl().targets);
            }
            return null;
        }

        void push(Var cond) {
            conds.add(cond);
            folds.add(null);
        }

        void pop() {
            conds.remove(conds.size() - 1);
            folds.remove(folds.size() - 1);
        }

        /**
         * The conjunction of the enclosing branch conditions, folded from the outermost in.
         */
        @Nullable
        Var control() {
            if (conds.isEmpty()) return null;
            for (int i = 0; i < conds.size(); i++) {
                if (folds.get(i) != null) continue;
                Var cond = conds.get(i);
                if (i == 0) {
                    folds.set(i, cond);
                } else {
                    Var outer = folds.get(i - 1);
                    folds.set(i, outer == cond ? cond : rb.and(outer, cond));
                }
            }
            return folds.get(folds.size() - 1);
        }

        void translateEffect(Effect effect) {
            Converter cc = FX_CONVERTERS.get(effect.insn().op.key);
            if (cc == null) {
                throw new UnsupportedOpException("op " + effect.insn().op + " is not supported");
            }
            cc.convert(effect, this);
        }

        void translateReturn(Insn insn) {
            if (insn.args().isEmpty()) {
                rb.ret(null);
                return;
            }
            Var arg = insn.args().get(0);
            rb.ret(bools.containsKey(arg) ? bools.get(arg) : materialize(arg));
        }

        Expr intExpr(Var var) {
            Expr expr = ints.get(var);
            if (expr == null) {
                if (bools.containsKey(var)) {
                    throw new UnsupportedOpException("boolean " + var + " used as an integer");
                }
                throw new UndefinedValueException(var + " is used before it is defined");
            }
            return expr;
        }

        Var bool(Var var) {
            Var q = bools.get(var);
            if (q == null) {
                if (ints.containsKey(var)) {
                    throw new UnsupportedOpException("integer " + var + " used as a boolean");
                }
                throw new UndefinedValueException(var + " is used before it is defined");
            }
            return q;
        }

        Var materialize(Var var) {
            return materialize(intExpr(var));
        }

        /**
         * Get a current value of an expression, recomputing it if its register has been overwritten.
         * Only fresh registers are written, so no other value goes stale.
         */
        Var materialize(Expr expr) {
            Var q = live.get(expr);
            if (q != null && rb.getAllocator().isCurrent(q.register())) {
                return q;
            }
            if (q != null && LOGGER.isDebugEnabled()) {
                LOGGER.debug("recomputing " + expr + ", " + q + " was overwritten");
            }
            q = rebuild(expr);
            live.put(expr, q);
            return q;
        }

        Var rebuild(Expr expr) {
            Var q = expr.accept(new Expr.Visitor<Var>() {
                @Override
                public Var visitConst(Expr.Const c) {
                    return rb.init(c.value, c.width, "");
                }

                @Override
                public Var visitBinary(Expr.BinaryOf b) {
                    Var lhs = rebuild(b.lhs);
                    return rb.binary(b.op, lhs, materialize(b.rhs), b.control);
                }

                @Override
                public Var visitBinaryImm(Expr.BinaryImmOf b) {
                    return rb.binaryImm(b.op, rebuild(b.lhs), b.imm, b.control);
                }
            });
            q.attachExt(CommonExts.DEFINITION, expr);
            return q;
        }

        /**
         * Materialise two operands, duplicating the right one if they are the same version.
         */
        Var[] operands(Expr lhs, Expr rhs) {
            Var l = materialize(lhs);
            Var r = materialize(rhs);
            if (l.register().equals(r.register())) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("duplicating " + r + " to read it twice");
                }
                r = rb.copy(r, "d");
            }
            return new Var[]{l, r};
        }

        void define(Var classical, Expr expr, Var q) {
            q.attachExt(CommonExts.DEFINITION, expr);
            ints.put(classical, expr);
            live.put(expr, q);
        }

        Map<Var, Var> valueMap() {
            Map<Var, Var> map = new LinkedHashMap<>();
            for (Map.Entry<Var, Expr> entry : ints.entrySet()) {
                map.put(entry.getKey(), live.get(entry.getValue()));
            }
            map.putAll(bools);
            return map;
        }
    }

    private interface Converter {
        void convert(Effect effect, Ctx ctx);
    }

    private static final Map<OpKey, Converter> FX_CONVERTERS = new HashMap<>();

    static {
        FX_CONVERTERS.put(ClassicalOps.CONST, (fx, ctx) -> {
            long value = TwosComplement.checkRange(ClassicalOps.CONST.cast(fx.insn().op).arg, ctx.width);
            Expr expr = new Expr.Const(value, ctx.width);
            ctx.define(fx.result(), expr, ctx.rb.init(value, ctx.width, ""));
        });
        FX_CONVERTERS.put(ClassicalOps.ARITH, (fx, ctx) -> {
            ArithOp op = ClassicalOps.ARITH.cast(fx.insn().op).arg;
            Expr lhs = ctx.intExpr(fx.insn().args().get(0));
            Expr rhs = ctx.intExpr(fx.insn().args().get(1));
            Var[] operands = ctx.operands(lhs, rhs);
            Var ctrl = ctx.control();
            ctx.define(fx.result(), new Expr.BinaryOf(op, lhs, rhs, ctrl),
                    ctx.rb.binary(op, operands[0], operands[1], ctrl));
        });
        FX_CONVERTERS.put(ClassicalOps.ARITH_IMM, (fx, ctx) -> {
            ArithImm arith = ClassicalOps.ARITH_IMM.cast(fx.insn().op).arg;
            if (arith.op == ArithOp.DIV && arith.imm == 0) {
                throw new DivisionByZeroException("division of " + fx.insn().args().get(0) + " by immediate zero");
            }
            TwosComplement.checkRange(arith.imm, ctx.width);
            Expr lhs = ctx.intExpr(fx.insn().args().get(0));
            Var l = ctx.materialize(lhs);
            Var ctrl = ctx.control();
            ctx.define(fx.result(), new Expr.BinaryImmOf(arith.op, lhs, arith.imm, ctrl),
                    ctx.rb.binaryImm(arith.op, l, arith.imm, ctrl));
        });
        FX_CONVERTERS.put(ClassicalOps.CMP, (fx, ctx) -> {
            Predicate pred = ClassicalOps.CMP.cast(fx.insn().op).arg;
            Var[] operands = ctx.operands(
                    ctx.intExpr(fx.insn().args().get(0)),
                    ctx.intExpr(fx.insn().args().get(1)));
            ctx.bools.put(fx.result(), ctx.rb.cmp(pred, operands[0], operands[1]));
        });
        FX_CONVERTERS.put(ClassicalOps.AND.key, (fx, ctx) -> {
            Var l = ctx.bool(fx.insn().args().get(0));
            Var r = ctx.bool(fx.insn().args().get(1));
            // booleans are never overwritten, and x & x is x
            ctx.bools.put(fx.result(), l == r ? l : ctx.rb.and(l, r));
        });
        FX_CONVERTERS.put(ClassicalOps.OR.key, (fx, ctx) -> {
            Var l = ctx.bool(fx.insn().args().get(0));
            Var r = ctx.bool(fx.insn().args().get(1));
            ctx.bools.put(fx.result(), l == r ? l : ctx.rb.or(l, r));
        });
        FX_CONVERTERS.put(ClassicalOps.NOT.key, (fx, ctx) ->
                ctx.bools.put(fx.result(), ctx.rb.not(ctx.bool(fx.insn().args().get(0)))));
        FX_CONVERTERS.put(CommonOps.PHI, (fx, ctx) -> {
            BasicBlock block = fx.getExtOrThrow(CommonExts.OWNING_BLOCK);
            List<BasicBlock> preds = CommonOps.PHI.cast(fx.insn().op).arg;
            List<Var> values = fx.insn().args();
            if (preds.size() != values.size()) {
                throw new IllegalArgumentException("phi " + fx + " has " + preds.size()
                        + " predecessors but " + values.size() + " values");
            }
            for (BasicBlock pred : ctx.preds.get(block)) {
                if (ctx.edgeControls.containsKey(Pair.of(pred, block)) && !preds.contains(pred)) {
                    throw new UnsupportedOpException("phi " + fx + " has no value for the edge from "
                            + pred.toTargetString());
                }
            }
            Expr expr = new Expr.Const(0, ctx.width);
            Var sum = ctx.rb.init(0, ctx.width, "");
            sum.attachExt(CommonExts.DEFINITION, expr);
            for (int i = 0; i < preds.size(); i++) {
                Pair<BasicBlock, BasicBlock> edge = Pair.of(preds.get(i), block);
                if (!ctx.edgeControls.containsKey(edge)) {
                    throw new UnsupportedOpException("phi " + fx + " merges from "
                            + preds.get(i).toTargetString() + ", which does not jump to its block");
                }
                Var ctrl = ctx.edgeControls.get(edge);
                Expr value = ctx.intExpr(values.get(i));
                Var v = ctx.materialize(value);
                expr = new Expr.BinaryOf(ArithOp.ADD, expr, value, ctrl);
                sum = ctx.rb.binary(ArithOp.ADD, sum, v, ctrl);
                sum.attachExt(CommonExts.DEFINITION, expr);
            }
            ctx.define(fx.result(), expr, sum);
        });
    }
}
