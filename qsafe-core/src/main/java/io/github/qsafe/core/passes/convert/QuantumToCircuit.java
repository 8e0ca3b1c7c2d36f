package io.github.qsafe.core.passes.convert;

import io.github.qsafe.core.UndefinedValueException;
import io.github.qsafe.core.UnsupportedOpException;
import io.github.qsafe.core.circuit.*;
import io.github.qsafe.core.ops.*;
import io.github.qsafe.core.passes.IRPass;
import io.github.qsafe.core.passes.meta.StraightLine;
import io.github.qsafe.core.reg.RegisterRef;
import io.github.qsafe.core.ssa.*;
import io.github.qsafe.core.util.TwosComplement;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Lowers a quantum-safe function, whose register constraints hold, to a gate-level circuit.
 * <p>
 * Each logical register is backed by a physical qubit register. In-place additions and
 * subtractions act on it directly. Multiplication and division write a fresh physical
 * register, which then backs the logical register from the next version on.
 */
public class QuantumToCircuit implements IRPass<Function, CompiledCircuit> {
    private static final Logger LOGGER = Logger.getLogger(QuantumToCircuit.class);

    public static final QuantumToCircuit INSTANCE = new QuantumToCircuit();

    @Override
    public CompiledCircuit run(Function func) {
        BasicBlock block = StraightLine.blockOf(func);
        Ctx ctx = new Ctx();
        Set<Var> booleans = new HashSet<>();
        for (Effect effect : block.getEffects()) {
            Converter converter = FX_CONVERTERS.get(effect.insn().op.key);
            if (converter == null) {
                throw new UnsupportedOpException("no circuit for " + effect.insn());
            }
            ctx.values.put(effect.result(), converter.convert(effect, ctx));
            ctx.physical.put(effect.result().register().registerId, ctx.values.get(effect.result()));
            if (QuantumOps.isBoolean(effect.insn())) booleans.add(effect.result());
        }
        List<Var> returned = block.getControl().insn().args();
        QubitRegister ret = returned.isEmpty() ? null : ctx.reg(returned.get(0));
        boolean returnsBoolean = !returned.isEmpty() && booleans.contains(returned.get(0));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("circuit for " + block.getEffects().size() + " operation(s): "
                    + ctx.circuit.getQubitCount() + " qubits, " + ctx.circuit.getGates().size() + " gates");
        }
        return new CompiledCircuit(ctx.circuit, ctx.values, ret, returnsBoolean, ctx.width);
    }

    private static final class Ctx {
        final QuantumCircuit circuit = new QuantumCircuit();
        final Map<Var, QubitRegister> values = new LinkedHashMap<>();
        final Map<Integer, QubitRegister> physical = new HashMap<>();
        int width = 1;

        QubitRegister reg(Var var) {
            QubitRegister reg = values.get(var);
            if (reg == null) {
                throw new UndefinedValueException(var + " is not defined before use");
            }
            return reg;
        }

        /**
         * The physical register now backing the logical register of a value, which it is about to update.
         */
        QubitRegister target(Var var) {
            QubitRegister reg = physical.get(var.register().registerId);
            if (reg == null) {
                throw new UndefinedValueException(var + " is not defined before use");
            }
            return reg;
        }

        int[] controls(@Nullable Var ctrl) {
            return ctrl == null ? new int[0] : new int[]{reg(ctrl).qubit(0)};
        }

        /**
         * Make {@code out} hold {@code original} where the control is clear, given it is zero there.
         */
        void selectUnlessControlled(QubitRegister out, QubitRegister original, @Nullable Var ctrl) {
            if (ctrl == null) return;
            int c = reg(ctrl).qubit(0);
            circuit.applyX(c);
            QftArithmetic.addInPlace(circuit, out, original, c);
            circuit.applyX(c);
        }

        QubitRegister constant(long value, int width, String name) {
            QubitRegister reg = circuit.allocate(name, width);
            circuit.load(reg, TwosComplement.encode(value, width));
            return reg;
        }

        QubitRegister divide(QubitRegister lhs, QubitRegister rhs, @Nullable Var ctrl) {
            if (ctrl == null) {
                return Division.divide(circuit, lhs, rhs).quotient;
            }
            // the dividend is consumed, so keep a copy for when the control is clear
            QubitRegister keep = circuit.allocate("keep", lhs.width());
            QftArithmetic.addInPlace(circuit, keep, lhs);
            QubitRegister quot = Division.divide(circuit, lhs, rhs).quotient;
            QubitRegister out = circuit.allocate("sel", lhs.width());
            QftArithmetic.addInPlace(circuit, out, quot, controls(ctrl));
            selectUnlessControlled(out, keep, ctrl);
            return out;
        }
    }

    private interface Converter {
        QubitRegister convert(Effect fx, Ctx ctx);
    }

    private static final Map<OpKey, Converter> FX_CONVERTERS = new HashMap<>();

    static {
        FX_CONVERTERS.put(QuantumOps.INIT, (fx, ctx) -> {
            RegisterRef ref = fx.result().register();
            ctx.width = Math.max(ctx.width, ref.width);
            return ctx.constant(QuantumOps.INIT.cast(fx.insn().op).arg, ref.width, "q" + ref.registerId);
        });
        FX_CONVERTERS.put(QuantumOps.BINARY, (fx, ctx) -> {
            ArithOp op = QuantumOps.BINARY.cast(fx.insn().op).arg;
            Var lhsVar = fx.insn().args().get(0);
            QubitRegister lhs = ctx.target(lhsVar);
            QubitRegister rhs = ctx.reg(fx.insn().args().get(1));
            Var ctrl = QuantumOps.controlOf(fx.insn());
            switch (op) {
                case ADD:
                    QftArithmetic.addInPlace(ctx.circuit, lhs, rhs, ctx.controls(ctrl));
                    return lhs;
                case SUB:
                    QftArithmetic.subInPlace(ctx.circuit, lhs, rhs, ctx.controls(ctrl));
                    return lhs;
                case MUL: {
                    QubitRegister out = QftArithmetic.mul(ctx.circuit, lhs, rhs, ctx.controls(ctrl));
                    ctx.selectUnlessControlled(out, lhs, ctrl);
                    return out;
                }
                case DIV:
                    return ctx.divide(lhs, rhs, ctrl);
                default:
                    throw new UnsupportedOpException("no circuit for " + fx.insn());
            }
        });
        FX_CONVERTERS.put(QuantumOps.BINARY_IMM, (fx, ctx) -> {
            ArithImm arith = QuantumOps.BINARY_IMM.cast(fx.insn().op).arg;
            QubitRegister lhs = ctx.target(fx.insn().args().get(0));
            Var ctrl = QuantumOps.controlOf(fx.insn());
            switch (arith.op) {
                case ADD:
                    QftArithmetic.addImmInPlace(ctx.circuit, lhs, arith.imm, ctx.controls(ctrl));
                    return lhs;
                case SUB:
                    QftArithmetic.subImmInPlace(ctx.circuit, lhs, arith.imm, ctx.controls(ctrl));
                    return lhs;
                case MUL: {
                    QubitRegister out = QftArithmetic.mulImm(ctx.circuit, lhs, arith.imm, ctx.controls(ctrl));
                    ctx.selectUnlessControlled(out, lhs, ctrl);
                    return out;
                }
                case DIV:
                    return ctx.divide(lhs, ctx.constant(arith.imm, lhs.width(), "divisor"), ctrl);
                default:
                    throw new UnsupportedOpException("no circuit for " + fx.insn());
            }
        });
        FX_CONVERTERS.put(QuantumOps.CMP, (fx, ctx) -> Comparison.compare(ctx.circuit,
                QuantumOps.CMP.cast(fx.insn().op).arg,
                ctx.reg(fx.insn().args().get(0)),
                ctx.reg(fx.insn().args().get(1))));
        FX_CONVERTERS.put(QuantumOps.AND.key, (fx, ctx) ->
                Comparison.and(ctx.circuit, ctx.reg(fx.insn().args().get(0)), ctx.reg(fx.insn().args().get(1))));
        FX_CONVERTERS.put(QuantumOps.OR.key, (fx, ctx) ->
                Comparison.or(ctx.circuit, ctx.reg(fx.insn().args().get(0)), ctx.reg(fx.insn().args().get(1))));
        FX_CONVERTERS.put(QuantumOps.NOT.key, (fx, ctx) ->
                Comparison.not(ctx.circuit, ctx.reg(fx.insn().args().get(0))));
    }
}
