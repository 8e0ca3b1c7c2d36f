package io.github.qsafe.test;

import io.github.qsafe.api.ClassicalReference;
import io.github.qsafe.core.ops.ArithOp;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.tree.ClassNode;

import static org.junit.jupiter.api.Assertions.*;

public class ClassicalReferenceTest {
    static final ClassicalReference REFERENCE = new ClassicalReference(4);

    @Test
    void testArithmeticWraps() {
        assertEquals(1, REFERENCE.evaluate(Programs.binary(ArithOp.ADD, 3, -2).func));
        assertEquals(-8, REFERENCE.evaluate(Programs.binary(ArithOp.ADD, 7, 1).func));
        assertEquals(-2, REFERENCE.evaluate(Programs.binary(ArithOp.MUL, 7, 2).func));
        assertEquals(-3, REFERENCE.evaluate(Programs.binary(ArithOp.DIV, -7, 2).func));
        assertEquals(-8, REFERENCE.evaluate(Programs.binary(ArithOp.DIV, -8, -1).func));
    }

    @Test
    void testBranches() {
        // a < b: (a + b) - (b - 1)
        assertEquals(3, REFERENCE.evaluate(Programs.branchy(2, 3).func));
        // otherwise: 2a - b
        assertEquals(5, REFERENCE.evaluate(Programs.branchy(3, 1).func));
        // 3 * 2 / 2 + 1
        assertEquals(4, REFERENCE.evaluate(Programs.nested(3, 2).func));
        // a + 1, as b >= a
        assertEquals(2, REFERENCE.evaluate(Programs.nested(1, 5).func));
    }

    @Test
    void testDivisionByZero() {
        assertThrows(ArithmeticException.class, () -> REFERENCE.evaluate(Programs.binary(ArithOp.DIV, 1, 0).func));
    }

    @Test
    void testCompile() {
        ClassNode cn = REFERENCE.compile(Programs.binary(ArithOp.SUB, 1, 2).func);
        assertEquals(1, cn.methods.size());
        assertEquals("run", cn.methods.get(0).name);
        assertEquals("()J", cn.methods.get(0).desc);
    }
}
