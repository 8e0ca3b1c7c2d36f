package io.github.qsafe.test;

import io.github.qsafe.core.UnsupportedOpException;
import io.github.qsafe.core.circuit.CompiledCircuit;
import io.github.qsafe.core.circuit.SimulationResult;
import io.github.qsafe.core.ops.ArithOp;
import io.github.qsafe.core.ops.ClassicalOps;
import io.github.qsafe.core.ops.Predicate;
import io.github.qsafe.core.passes.convert.QuantumToCircuit;
import io.github.qsafe.core.reg.RegisterAllocator;
import io.github.qsafe.core.reg.RegisterBuilder;
import io.github.qsafe.core.ssa.Function;
import io.github.qsafe.core.ssa.IRBuilder;
import io.github.qsafe.core.ssa.Var;
import io.github.qsafe.core.util.TwosComplement;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuantumToCircuitTest {
    static final int WIDTH = 4;
    static final long[][] OPERANDS = {{3, -2}, {-7, 2}, {5, 3}, {-8, -1}, {0, 5}, {6, -4}};

    final Function func = new Function();
    final RegisterBuilder rb = new RegisterBuilder(new IRBuilder(func, func.newBb()), new RegisterAllocator());

    long run() {
        CompiledCircuit cc = QuantumToCircuit.INSTANCE.run(func);
        assertEquals(WIDTH, cc.getWidth());
        assertNotNull(cc.getReturned());
        return cc.readReturned(Utils.simulate(cc.getCircuit()));
    }

    /**
     * A control qubit set to {@code value}, or no control at all if negative.
     */
    @Nullable
    Var control(int value) {
        if (value < 0) return null;
        return rb.cmp(Predicate.EQ, rb.init(value, WIDTH, ""), rb.init(1, WIDTH, ""));
    }

    static long expected(ArithOp op, long a, long b, int ctrl) {
        return ctrl == 0 ? a : TwosComplement.wrap(op.apply(a, b), WIDTH);
    }

    @Test
    void testBinary() {
        for (ArithOp op : ArithOp.values()) {
            for (long[] ab : OPERANDS) {
                for (int ctrl = -1; ctrl <= 1; ctrl++) {
                    QuantumToCircuitTest t = new QuantumToCircuitTest();
                    Var c = t.control(ctrl);
                    Var a = t.rb.init(ab[0], WIDTH, "");
                    Var b = t.rb.init(ab[1], WIDTH, "");
                    t.rb.ret(t.rb.binary(op, a, b, c));
                    assertEquals(expected(op, ab[0], ab[1], ctrl), t.run(),
                            ab[0] + " " + op.symbol + " " + ab[1] + " under " + ctrl);
                }
            }
        }
    }

    @Test
    void testBinaryImm() {
        for (ArithOp op : ArithOp.values()) {
            for (long[] ab : OPERANDS) {
                for (int ctrl = -1; ctrl <= 1; ctrl++) {
                    QuantumToCircuitTest t = new QuantumToCircuitTest();
                    Var c = t.control(ctrl);
                    t.rb.ret(t.rb.binaryImm(op, t.rb.init(ab[0], WIDTH, ""), ab[1], c));
                    assertEquals(expected(op, ab[0], ab[1], ctrl), t.run(),
                            ab[0] + " " + op.symbol + " " + ab[1] + " under " + ctrl);
                }
            }
        }
    }

    @Test
    void testRegistersFollowVersions() {
        Var a = rb.init(2, WIDTH, "");
        Var b = rb.init(3, WIDTH, "");
        Var sum = rb.binary(ArithOp.ADD, a, b, null);
        Var prod = rb.binary(ArithOp.MUL, sum, b, null);
        rb.ret(prod);
        CompiledCircuit cc = QuantumToCircuit.INSTANCE.run(func);
        // in-place addition keeps the register, multiplication writes a fresh one
        assertSame(cc.registerOf(a), cc.registerOf(sum));
        assertNotSame(cc.registerOf(sum), cc.registerOf(prod));
        assertSame(cc.registerOf(prod), cc.getReturned());
        SimulationResult result = Utils.simulate(cc.getCircuit());
        assertEquals(15 - 16, result.measureSigned(cc.getReturned()));
        assertEquals(5, result.measureSigned(cc.registerOf(sum)));
    }

    @Test
    void testSingleQubitIntegerIsSigned() {
        Var a = rb.init(-1, 1, "");
        Var b = rb.init(0, 1, "");
        rb.ret(rb.binary(ArithOp.ADD, a, b, null));
        CompiledCircuit cc = QuantumToCircuit.INSTANCE.run(func);
        assertFalse(cc.returnsBoolean());
        assertEquals(-1, cc.readReturned(Utils.simulate(cc.getCircuit())));
    }

    @Test
    void testBooleanReturnIsZeroOrOne() {
        rb.ret(rb.cmp(Predicate.LT, rb.init(-3, WIDTH, ""), rb.init(2, WIDTH, "")));
        CompiledCircuit cc = QuantumToCircuit.INSTANCE.run(func);
        assertTrue(cc.returnsBoolean());
        SimulationResult result = Utils.simulate(cc.getCircuit());
        assertTrue(result.measureBoolean(cc.getReturned()));
        assertEquals(1, cc.readReturned(result));
    }

    @Test
    void testRejectsClassicalOps() {
        new IRBuilder(func, func.getEntry()).insert(ClassicalOps.constant(1), "k");
        rb.ret(null);
        assertThrows(UnsupportedOpException.class, () -> QuantumToCircuit.INSTANCE.run(func));
    }
}
