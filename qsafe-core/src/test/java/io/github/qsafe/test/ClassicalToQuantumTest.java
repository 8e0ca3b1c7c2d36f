package io.github.qsafe.test;

import io.github.qsafe.core.*;
import io.github.qsafe.core.circuit.CompiledCircuit;
import io.github.qsafe.core.conf.CompilerConfig;
import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ops.ArithOp;
import io.github.qsafe.core.ops.Predicate;
import io.github.qsafe.core.ops.QuantumOps;
import io.github.qsafe.core.passes.convert.ClassicalToQuantum;
import io.github.qsafe.core.passes.convert.QuantumToCircuit;
import io.github.qsafe.core.passes.meta.ComputePreds;
import io.github.qsafe.core.passes.meta.VerifyConstraints;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Effect;
import io.github.qsafe.core.ssa.Function;
import io.github.qsafe.core.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ClassicalToQuantumTest {
    static Function translate(Utils.Classical fn, int width) {
        Function q = new ClassicalToQuantum(CompilerConfig.builder().setBitWidth(width).build()).run(fn.func);
        assertEquals(1, q.getBlocks().size());
        assertEquals(CommonExts.CodeType.QUANTUM, q.getExtOrThrow(CommonExts.CODE_TYPE));
        assertEquals(0, VerifyConstraints.findViolations(q).size(), q::toString);
        return q;
    }

    static long run(Utils.Classical fn, int width) {
        CompiledCircuit cc = QuantumToCircuit.INSTANCE.run(translate(fn, width));
        assertNotNull(cc.getReturned());
        return cc.readReturned(Utils.simulate(cc.getCircuit()));
    }

    @Test
    void testAdd() {
        Utils.Classical fn = new Utils.Classical();
        fn.ret(fn.arith(ArithOp.ADD, fn.constant(3), fn.constant(-2)));
        assertEquals(1, run(fn, 4));
    }

    @Test
    void testOverwrittenOperandIsRecomputed() {
        Utils.Classical fn = new Utils.Classical();
        Var a = fn.constant(2);
        Var b = fn.constant(3);
        Var c = fn.arith(ArithOp.ADD, a, b);
        Var d = fn.arith(ArithOp.MUL, a, b);
        fn.ret(fn.arith(ArithOp.SUB, d, c));
        assertEquals(1, run(fn, 5));
    }

    @Test
    void testSameOperandTwice() {
        Utils.Classical fn = new Utils.Classical();
        Var a = fn.constant(3);
        fn.ret(fn.arith(ArithOp.ADD, a, a));
        assertEquals(6, run(fn, 4));
    }

    @Test
    void testWrapping() {
        Utils.Classical fn = new Utils.Classical();
        fn.ret(fn.arithImm(ArithOp.MUL, fn.constant(5), 3));
        assertEquals(-1, run(fn, 4));
    }

    @Test
    void testInPlaceOpsOverwriteTheirLhs() {
        Utils.Classical fn = new Utils.Classical();
        Var a = fn.constant(1);
        Var b = fn.arithImm(ArithOp.ADD, a, 2);
        fn.ret(b);
        Function q = translate(fn, 4);
        Map<Var, Var> values = q.getExtOrThrow(CommonExts.VALUE_MAP);
        Effect add = q.getEntry().getEffects().get(1);
        assertSame(add.result(), values.get(b));
        assertEquals(values.get(a).register().registerId, values.get(b).register().registerId);
        assertSame(QuantumOps.BINARY_IMM, add.insn().op.key);
        assertEquals(add.insn().args().get(0).register().next(), add.result().register());
    }

    static long branch(long value, long threshold) {
        // x = value > threshold ? value - 1 : value + 1
        Utils.Classical fn = new Utils.Classical();
        BasicBlock ifTrue = fn.newBb();
        BasicBlock ifFalse = fn.newBb();
        BasicBlock join = fn.newBb();
        Var a = fn.constant(value);
        fn.condBr(fn.cmp(Predicate.GT, a, fn.constant(threshold)), ifTrue, ifFalse);
        Var dec = fn.at(ifTrue).arithImm(ArithOp.SUB, a, 1);
        fn.br(join);
        Var inc = fn.at(ifFalse).arithImm(ArithOp.ADD, a, 1);
        fn.br(join);
        fn.at(join).ret(fn.phi(new BasicBlock[]{ifTrue, ifFalse}, dec, inc));
        return run(fn, 4);
    }

    @Test
    void testBranch() {
        assertEquals(4, branch(5, 2));
        assertEquals(2, branch(1, 2));
        assertEquals(-7, branch(-8, 0));
    }

    @Test
    void testBranchWithoutElse() {
        for (long cond = 0; cond <= 1; cond++) {
            Utils.Classical fn = new Utils.Classical();
            BasicBlock then = fn.newBb();
            BasicBlock join = fn.newBb();
            BasicBlock entry = fn.func.getEntry();
            Var a = fn.constant(3);
            Var c = fn.cmp(Predicate.EQ, fn.constant(cond), fn.constant(1));
            fn.condBr(c, then, join);
            Var doubled = fn.at(then).arith(ArithOp.ADD, a, a);
            fn.br(join);
            fn.at(join).ret(fn.phi(new BasicBlock[]{then, entry}, doubled, a));
            assertEquals(cond == 1 ? 6 : 3, run(fn, 4));
        }
    }

    @Test
    void testPredecessors() {
        Utils.Classical fn = new Utils.Classical();
        BasicBlock then = fn.newBb();
        BasicBlock join = fn.newBb();
        BasicBlock entry = fn.func.getEntry();
        Var a = fn.constant(3);
        fn.condBr(fn.cmp(Predicate.EQ, a, fn.constant(1)), then, join);
        fn.at(then).br(join);
        fn.at(join).ret(a);

        Map<BasicBlock, List<BasicBlock>> preds = ComputePreds.INSTANCE.run(fn.func);
        assertEquals(Collections.emptyList(), preds.get(entry));
        assertEquals(Collections.singletonList(entry), preds.get(then));
        assertEquals(Arrays.asList(entry, then), preds.get(join));
    }

    @Test
    void testBlockEndsOnce() {
        Utils.Classical fn = new Utils.Classical();
        BasicBlock next = fn.newBb();
        assertEquals(2, fn.func.getBlocks().size());
        fn.br(next);
        assertThrows(IllegalStateException.class, () -> fn.ret(fn.constant(1)));
        fn.at(next).ret(fn.constant(1));
        assertEquals(1, run(fn, 2));
    }

    @Test
    void testPhiMissingAnEdge() {
        Utils.Classical fn = new Utils.Classical();
        BasicBlock then = fn.newBb();
        BasicBlock join = fn.newBb();
        Var a = fn.constant(3);
        fn.condBr(fn.cmp(Predicate.EQ, a, fn.constant(1)), then, join);
        Var doubled = fn.at(then).arith(ArithOp.ADD, a, a);
        fn.br(join);
        // the edge from the entry block carries no value
        fn.at(join).ret(fn.phi(new BasicBlock[]{then}, doubled));
        assertThrows(UnsupportedOpException.class, () -> translate(fn, 4));
    }

    @Test
    void testNestedBranchesAndLogic() {
        // if (a < b || a == 0) { if (!(b < 0)) r = a + b else r = a } else r = b
        for (long[] ab : new long[][]{{1, 2}, {0, -3}, {5, 1}, {-2, -1}}) {
            Utils.Classical fn = new Utils.Classical();
            BasicBlock outer = fn.newBb();
            BasicBlock inner = fn.newBb();
            BasicBlock innerJoin = fn.newBb();
            BasicBlock other = fn.newBb();
            BasicBlock join = fn.newBb();
            Var a = fn.constant(ab[0]);
            Var b = fn.constant(ab[1]);
            Var zero = fn.constant(0);
            Var cond = fn.or(fn.cmp(Predicate.LT, a, b), fn.cmp(Predicate.EQ, a, zero));
            fn.condBr(cond, outer, other);

            fn.at(outer).condBr(fn.not(fn.cmp(Predicate.LT, b, zero)), inner, innerJoin);
            Var sum = fn.at(inner).arith(ArithOp.ADD, a, b);
            fn.br(innerJoin);
            Var innerR = fn.at(innerJoin).phi(new BasicBlock[]{inner, outer}, sum, a);
            fn.br(join);

            fn.at(other).br(join);
            fn.at(join).ret(fn.phi(new BasicBlock[]{innerJoin, other}, innerR, b));

            long expected = ab[0] < ab[1] || ab[0] == 0 ? (ab[1] >= 0 ? ab[0] + ab[1] : ab[0]) : ab[1];
            assertEquals(expected, run(fn, 4), () -> Arrays.toString(ab));
        }
    }

    @Test
    void testReturnBoolean() {
        Utils.Classical fn = new Utils.Classical();
        fn.ret(fn.and(fn.cmp(Predicate.LE, fn.constant(2), fn.constant(2)), fn.cmp(Predicate.NE, fn.constant(1), fn.constant(2))));
        assertEquals(1, run(fn, 3));
    }

    @Test
    void testBackEdge() {
        Utils.Classical fn = new Utils.Classical();
        BasicBlock loop = fn.newBb();
        fn.constant(1);
        fn.br(loop);
        fn.at(loop).br(loop);
        assertThrows(UnsupportedOpException.class, () -> translate(fn, 4));
    }

    @Test
    void testReturnInsideConditional() {
        Utils.Classical fn = new Utils.Classical();
        BasicBlock early = fn.newBb();
        BasicBlock join = fn.newBb();
        Var a = fn.constant(1);
        fn.condBr(fn.cmp(Predicate.EQ, a, fn.constant(1)), early, join);
        fn.at(early).ret(a);
        fn.at(join).ret(a);
        assertThrows(UnsupportedOpException.class, () -> translate(fn, 4));
    }

    @Test
    void testUndefinedValue() {
        Utils.Classical fn = new Utils.Classical();
        fn.ret(fn.arith(ArithOp.ADD, fn.constant(1), fn.func.newVar("missing")));
        assertThrows(UndefinedValueException.class, () -> translate(fn, 4));
    }

    @Test
    void testDivisionByImmediateZero() {
        Utils.Classical fn = new Utils.Classical();
        fn.ret(fn.arithImm(ArithOp.DIV, fn.constant(1), 0));
        assertThrows(DivisionByZeroException.class, () -> translate(fn, 4));
    }

    @Test
    void testConstantOutOfRange() {
        Utils.Classical fn = new Utils.Classical();
        fn.ret(fn.constant(8));
        ValueOutOfRangeException e = assertThrows(ValueOutOfRangeException.class, () -> translate(fn, 4));
        assertEquals(8, e.value);
        assertEquals(4, e.width);
    }

    @Test
    void testBooleanAsInteger() {
        Utils.Classical fn = new Utils.Classical();
        Var c = fn.cmp(Predicate.EQ, fn.constant(1), fn.constant(1));
        fn.ret(fn.arithImm(ArithOp.ADD, c, 1));
        assertThrows(UnsupportedOpException.class, () -> translate(fn, 4));
    }
}
