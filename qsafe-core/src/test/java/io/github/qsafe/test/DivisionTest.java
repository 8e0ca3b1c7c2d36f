package io.github.qsafe.test;

import io.github.qsafe.core.circuit.Division;
import io.github.qsafe.core.circuit.QuantumCircuit;
import io.github.qsafe.core.circuit.QubitRegister;
import io.github.qsafe.core.circuit.SimulationResult;
import io.github.qsafe.core.util.TwosComplement;
import org.junit.jupiter.api.Test;

import static io.github.qsafe.test.Utils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class DivisionTest {
    SimulationResult divide(long a, long b, int width, boolean signed, long quotient, long remainder) {
        QuantumCircuit c = new QuantumCircuit();
        QubitRegister ra = loaded(c, "a", a, width);
        QubitRegister rb = loaded(c, "b", b, width);
        Division.Result res = signed ? Division.divide(c, ra, rb) : Division.divideUnsigned(c, ra, rb);
        SimulationResult result = simulate(c);
        String msg = a + " / " + b;
        if (signed) {
            assertEquals(quotient, result.measureSigned(res.quotient), msg);
            assertEquals(remainder, result.measureSigned(res.remainder), msg);
            assertEquals(b, result.measureSigned(rb), "divisor is restored");
        } else {
            assertEquals(quotient, result.measureUnsigned(res.quotient), msg);
            assertEquals(remainder, result.measureUnsigned(res.remainder), msg);
            assertEquals(b, result.measureUnsigned(rb), "divisor is restored");
        }
        assertEquals(0, result.measureUnsigned(ra), "dividend is consumed");
        return result;
    }

    @Test
    void testUnsignedExample() {
        divide(6, 2, 6, false, 3, 0);
        divide(45, 7, 6, false, 6, 3);
    }

    @Test
    void testUnsigned() {
        for (long a = 0; a < 8; a++) {
            for (long b = 1; b < 8; b++) {
                divide(a, b, 3, false, a / b, a % b);
            }
        }
    }

    @Test
    void testSigned() {
        int width = 3;
        range(width).forEach(a -> range(width).forEach(b -> {
            if (b == 0) return;
            divide(a, b, width, true, TwosComplement.wrap(a / b, width), a % b);
        }));
    }

    @Test
    void testSignedExamples() {
        divide(-7, 2, 4, true, -3, -1);
        divide(7, -2, 4, true, -3, 1);
        divide(-8, 3, 4, true, -2, -2);
    }

    @Test
    void testAbs() {
        range(4).forEach(a -> {
            QuantumCircuit c = new QuantumCircuit();
            QubitRegister ra = loaded(c, "a", a, 4);
            Division.abs(c, ra);
            assertEquals(Math.abs(a), simulate(c).measureUnsigned(ra));
        });
    }
}
