package io.github.qsafe.test;

import io.github.qsafe.core.circuit.QuantumCircuit;
import io.github.qsafe.core.circuit.QubitRegister;
import io.github.qsafe.core.circuit.SimulationResult;
import io.github.qsafe.core.circuit.StateVectorSimulator;
import io.github.qsafe.core.ops.*;
import io.github.qsafe.core.ssa.*;
import io.github.qsafe.core.util.TwosComplement;

import java.util.Arrays;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class Utils {
    public static QubitRegister loaded(QuantumCircuit c, String name, long value, int width) {
        QubitRegister reg = c.allocate(name, width);
        c.load(reg, TwosComplement.encode(value, width));
        return reg;
    }

    public static SimulationResult simulate(QuantumCircuit c) {
        SimulationResult result = new StateVectorSimulator().run(c);
        assertEquals(1, result.getMostLikelyProbability(), 1e-6, "circuit ends in a superposition");
        return result;
    }

    public static LongStream range(int width) {
        return LongStream.rangeClosed(TwosComplement.minValue(width), TwosComplement.maxValue(width));
    }

    /**
     * Builds classical functions.
     */
    public static class Classical {
        public final Function func = new Function();
        public final IRBuilder ib = new IRBuilder(func, func.newBb());

        public BasicBlock newBb() {
            return ib.newBlock();
        }

        public Classical at(BasicBlock block) {
            ib.setBlock(block);
            return this;
        }

        public Var constant(long k) {
            return ib.insert(ClassicalOps.constant(k), "k");
        }

        public Var arith(ArithOp op, Var lhs, Var rhs) {
            return ib.insert(ClassicalOps.arith(op, lhs, rhs), op.mnemonic);
        }

        public Var arithImm(ArithOp op, Var lhs, long imm) {
            return ib.insert(ClassicalOps.arithImm(op, lhs, imm), op.mnemonic);
        }

        public Var cmp(Predicate pred, Var lhs, Var rhs) {
            return ib.insert(ClassicalOps.cmp(pred, lhs, rhs), pred.mnemonic);
        }

        public Var and(Var lhs, Var rhs) {
            return ib.insert(ClassicalOps.AND.insn(lhs, rhs), "and");
        }

        public Var or(Var lhs, Var rhs) {
            return ib.insert(ClassicalOps.OR.insn(lhs, rhs), "or");
        }

        public Var not(Var arg) {
            return ib.insert(ClassicalOps.NOT.insn(arg), "not");
        }

        public Var phi(BasicBlock[] preds, Var... values) {
            return ib.insert(CommonOps.PHI.create(Arrays.asList(preds)).insn(values), "phi");
        }

        public void br(BasicBlock target) {
            ib.insertCtrl(Control.br(target));
        }

        public void condBr(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
            ib.insertCtrl(ClassicalOps.condBr(cond, ifTrue, ifFalse));
        }

        public void ret(Var... values) {
            ib.insertCtrl(Control.ret(values));
        }
    }
}
