package io.github.qsafe.core.circuit;

/**
 * Restoring division of two's complement registers.
 * <p>
 * The remainder is worked in a register two bits wider than the operands, so the sign
 * of each trial subtraction is exact over the whole range. The bits of the dividend
 * are shifted into the remainder, leaving the dividend register zeroed: the dividend
 * is consumed. The divisor is left unchanged. Division by zero is not detected and
 * gives an unspecified result.
 */
public final class Division {
    private Division() {
    }

    /**
     * The registers of a division.
     */
    public static final class Result {
        public final QubitRegister quotient;
        public final QubitRegister remainder;

        Result(QubitRegister quotient, QubitRegister remainder) {
            this.quotient = quotient;
            this.remainder = remainder;
        }
    }

    /**
     * Divide unsigned registers.
     *
     * @param c The circuit.
     * @param a The dividend, consumed.
     * @param b The divisor.
     * @return The quotient and remainder, of the operands' width.
     */
    public static Result divideUnsigned(QuantumCircuit c, QubitRegister a, QubitRegister b) {
        int n = a.width();
        if (b.width() != n) {
            throw new IllegalArgumentException("width mismatch: " + a + " / " + b);
        }
        QubitRegister quot = c.allocate("quot", n);
        QubitRegister rem = c.allocate("rem", n + 2);
        QubitRegister flag = c.allocate("flag", 1);
        int f = flag.qubit(0);
        for (int i = n - 1; i >= 0; i--) {
            // shift the remainder left and bring in the next dividend bit
            for (int j = rem.width() - 1; j >= 1; j--) {
                c.applySwap(rem.qubit(j), rem.qubit(j - 1));
            }
            c.applySwap(rem.qubit(0), a.qubit(i));

            QftArithmetic.subInPlace(c, rem, b);
            c.applyCx(rem.msb(), f);
            QftArithmetic.addInPlace(c, rem, b, f);

            c.applyX(quot.qubit(i));
            c.applyCx(f, quot.qubit(i));
            // flag is always the complement of the quotient bit here
            c.applyCx(quot.qubit(i), f);
            c.applyX(f);
        }
        return new Result(quot, new QubitRegister(rem.name, rem.qubit(0), n));
    }

    /**
     * Divide signed registers, truncating toward zero. The remainder takes the sign of the dividend.
     *
     * @param c The circuit.
     * @param a The dividend, consumed.
     * @param b The divisor, restored afterwards.
     * @return The quotient and remainder.
     */
    public static Result divide(QuantumCircuit c, QubitRegister a, QubitRegister b) {
        QubitRegister signA = toSignMagnitude(c, a);
        QubitRegister signB = toSignMagnitude(c, b);

        Result mag = divideUnsigned(c, a, b);

        QubitRegister signQ = c.allocate("signq", 1);
        c.applyCx(signA.qubit(0), signQ.qubit(0));
        c.applyCx(signB.qubit(0), signQ.qubit(0));
        fromSignMagnitude(c, mag.quotient, signQ);
        fromSignMagnitude(c, mag.remainder, signA);

        fromSignMagnitude(c, b, signB);
        c.applyCx(b.msb(), signB.qubit(0));
        return mag;
    }

    /**
     * Convert a register in place to its magnitude, returning a fresh register holding its sign.
     * The magnitude of the minimum value is read unsigned.
     *
     * @param c   The circuit.
     * @param reg The register.
     * @return The 1-qubit sign register.
     */
    public static QubitRegister toSignMagnitude(QuantumCircuit c, QubitRegister reg) {
        QubitRegister sign = c.allocate("sign", 1);
        c.applyCx(reg.msb(), sign.qubit(0));
        QftArithmetic.negateInPlace(c, reg, sign.qubit(0));
        return sign;
    }

    public static void fromSignMagnitude(QuantumCircuit c, QubitRegister magnitude, QubitRegister sign) {
        QftArithmetic.negateInPlace(c, magnitude, sign.qubit(0));
    }

    /**
     * Replace a register by its absolute value.
     *
     * @param c   The circuit.
     * @param reg The register.
     * @return The register.
     */
    public static QubitRegister abs(QuantumCircuit c, QubitRegister reg) {
        toSignMagnitude(c, reg);
        return reg;
    }
}
