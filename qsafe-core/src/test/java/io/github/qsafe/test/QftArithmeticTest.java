package io.github.qsafe.test;

import io.github.qsafe.core.circuit.*;
import io.github.qsafe.core.util.TwosComplement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.qsafe.test.Utils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class QftArithmeticTest {
    static final int WIDTH = 3;

    interface InPlace {
        void apply(QuantumCircuit c, QubitRegister target, QubitRegister source, int... controls);
    }

    void checkInPlace(InPlace op, long a, long b, long expected, int... ctrlValues) {
        QuantumCircuit c = new QuantumCircuit();
        QubitRegister ra = loaded(c, "a", a, WIDTH);
        QubitRegister rb = loaded(c, "b", b, WIDTH);
        int[] controls = new int[ctrlValues.length];
        for (int i = 0; i < ctrlValues.length; i++) {
            controls[i] = loaded(c, "ctrl", ctrlValues[i], 1).qubit(0);
        }
        op.apply(c, ra, rb, controls);
        SimulationResult result = simulate(c);
        String msg = a + ", " + b + " under " + Arrays.toString(ctrlValues);
        assertEquals(expected, result.measureSigned(ra), msg);
        assertEquals(b, result.measureSigned(rb), msg);
    }

    @Test
    void testAdd() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(b ->
                checkInPlace(QftArithmetic::addInPlace, a, b, TwosComplement.wrap(a + b, WIDTH))));
    }

    @Test
    void testSub() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(b ->
                checkInPlace(QftArithmetic::subInPlace, a, b, TwosComplement.wrap(a - b, WIDTH))));
    }

    @Test
    void testControlledAdd() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(b -> {
            checkInPlace(QftArithmetic::addInPlace, a, b, a, 0);
            checkInPlace(QftArithmetic::addInPlace, a, b, TwosComplement.wrap(a + b, WIDTH), 1);
            checkInPlace(QftArithmetic::addInPlace, a, b, a, 1, 0);
            checkInPlace(QftArithmetic::addInPlace, a, b, TwosComplement.wrap(a + b, WIDTH), 1, 1);
        }));
    }

    @Test
    void testControlledSub() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(b -> {
            checkInPlace(QftArithmetic::subInPlace, a, b, a, 0);
            checkInPlace(QftArithmetic::subInPlace, a, b, TwosComplement.wrap(a - b, WIDTH), 1);
        }));
    }

    @Test
    void testAddImm() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(imm -> {
            for (int ctrl = -1; ctrl <= 1; ctrl++) {
                QuantumCircuit c = new QuantumCircuit();
                QubitRegister ra = loaded(c, "a", a, WIDTH);
                int[] controls = ctrl < 0 ? new int[0] : new int[]{loaded(c, "ctrl", ctrl, 1).qubit(0)};
                QftArithmetic.addImmInPlace(c, ra, imm, controls);
                long expected = ctrl == 0 ? a : TwosComplement.wrap(a + imm, WIDTH);
                assertEquals(expected, simulate(c).measureSigned(ra), a + " + " + imm);

                c = new QuantumCircuit();
                ra = loaded(c, "a", a, WIDTH);
                controls = ctrl < 0 ? new int[0] : new int[]{loaded(c, "ctrl", ctrl, 1).qubit(0)};
                QftArithmetic.subImmInPlace(c, ra, imm, controls);
                expected = ctrl == 0 ? a : TwosComplement.wrap(a - imm, WIDTH);
                assertEquals(expected, simulate(c).measureSigned(ra), a + " - " + imm);
            }
        }));
    }

    @Test
    void testMul() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(b -> {
            for (int ctrl = -1; ctrl <= 1; ctrl++) {
                QuantumCircuit c = new QuantumCircuit();
                QubitRegister ra = loaded(c, "a", a, WIDTH);
                QubitRegister rb = loaded(c, "b", b, WIDTH);
                int[] controls = ctrl < 0 ? new int[0] : new int[]{loaded(c, "ctrl", ctrl, 1).qubit(0)};
                QubitRegister prod = QftArithmetic.mul(c, ra, rb, controls);
                SimulationResult result = simulate(c);
                long expected = ctrl == 0 ? 0 : TwosComplement.wrap(a * b, WIDTH);
                assertEquals(expected, result.measureSigned(prod), a + " * " + b);
                assertEquals(a, result.measureSigned(ra));
                assertEquals(b, result.measureSigned(rb));
            }
        }));
    }

    @Test
    void testMulImm() {
        range(WIDTH).forEach(a -> range(WIDTH).forEach(k -> {
            QuantumCircuit c = new QuantumCircuit();
            QubitRegister ra = loaded(c, "a", a, WIDTH);
            QubitRegister prod = QftArithmetic.mulImm(c, ra, k);
            assertEquals(TwosComplement.wrap(a * k, WIDTH), simulate(c).measureSigned(prod), a + " * " + k);
        }));
    }

    @Test
    void testNegate() {
        range(4).forEach(a -> {
            QuantumCircuit c = new QuantumCircuit();
            QubitRegister ra = loaded(c, "a", a, 4);
            QftArithmetic.negateInPlace(c, ra);
            assertEquals(TwosComplement.wrap(-a, 4), simulate(c).measureSigned(ra));
        });
    }

    @Test
    void testWidthFourExample() {
        QuantumCircuit c = new QuantumCircuit();
        QubitRegister ra = loaded(c, "a", 3, 4);
        QubitRegister rb = loaded(c, "b", -2, 4);
        QftArithmetic.addInPlace(c, ra, rb);
        assertEquals(1, simulate(c).measureSigned(ra));
    }

    @Test
    void testCopySignExtended() {
        range(WIDTH).forEach(a -> {
            QuantumCircuit c = new QuantumCircuit();
            QubitRegister ra = loaded(c, "a", a, WIDTH);
            QubitRegister wide = QftArithmetic.copySignExtended(c, ra, WIDTH + 2, "wide");
            SimulationResult result = simulate(c);
            assertEquals(a, result.measureSigned(wide));
            assertEquals(a, result.measureSigned(ra));
        });
    }
}
