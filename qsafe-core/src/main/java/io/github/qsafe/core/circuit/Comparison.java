package io.github.qsafe.core.circuit;

import io.github.qsafe.core.ops.Predicate;

/**
 * Comparisons and boolean operations. Each writes its result to a fresh 1-qubit register,
 * leaving its operands unchanged.
 */
public final class Comparison {
    private Comparison() {
    }

    public static QubitRegister compare(QuantumCircuit c, Predicate pred, QubitRegister a, QubitRegister b) {
        QubitRegister l = pred.swapsOperands() ? b : a;
        QubitRegister r = pred.swapsOperands() ? a : b;
        QubitRegister res = pred.base() == Predicate.EQ ? equal(c, l, r) : lessThan(c, l, r);
        return pred.negatesResult() ? not(c, res) : res;
    }

    /**
     * {@code a == b}, by testing {@code a xor b} for zero.
     */
    public static QubitRegister equal(QuantumCircuit c, QubitRegister a, QubitRegister b) {
        int n = a.width();
        QubitRegister xor = c.allocate("xor", n);
        int[] bits = new int[n];
        for (int i = 0; i < n; i++) {
            c.applyCx(a.qubit(i), xor.qubit(i));
            c.applyCx(b.qubit(i), xor.qubit(i));
            c.applyX(xor.qubit(i));
            bits[i] = xor.qubit(i);
        }
        QubitRegister out = c.allocate("eq", 1);
        c.applyMcx(bits, out.qubit(0));
        for (int bit : bits) {
            c.applyX(bit);
        }
        return out;
    }

    /**
     * {@code a < b}, as the sign of {@code a - b}, computed one bit wider so it cannot overflow.
     */
    public static QubitRegister lessThan(QuantumCircuit c, QubitRegister a, QubitRegister b) {
        int n = a.width();
        QubitRegister diff = QftArithmetic.copySignExtended(c, a, n + 1, "diff");
        QubitRegister negB = QftArithmetic.copySignExtended(c, b, n + 1, "bneg");
        QftArithmetic.negateInPlace(c, negB);
        QftArithmetic.addInPlace(c, diff, negB);
        QubitRegister out = c.allocate("lt", 1);
        c.applyCx(diff.msb(), out.qubit(0));
        return out;
    }

    public static QubitRegister and(QuantumCircuit c, QubitRegister a, QubitRegister b) {
        QubitRegister out = c.allocate("and", 1);
        c.applyMcx(new int[]{a.qubit(0), b.qubit(0)}, out.qubit(0));
        return out;
    }

    /**
     * {@code a | b}, as {@code !(!a & !b)}.
     */
    public static QubitRegister or(QuantumCircuit c, QubitRegister a, QubitRegister b) {
        QubitRegister out = c.allocate("or", 1);
        c.applyX(a.qubit(0));
        c.applyX(b.qubit(0));
        c.applyMcx(new int[]{a.qubit(0), b.qubit(0)}, out.qubit(0));
        c.applyX(out.qubit(0));
        c.applyX(a.qubit(0));
        c.applyX(b.qubit(0));
        return out;
    }

    public static QubitRegister not(QuantumCircuit c, QubitRegister a) {
        QubitRegister out = c.allocate("not", 1);
        c.applyX(out.qubit(0));
        c.applyCx(a.qubit(0), out.qubit(0));
        return out;
    }
}
