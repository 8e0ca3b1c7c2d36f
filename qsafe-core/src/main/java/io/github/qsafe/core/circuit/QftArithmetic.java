package io.github.qsafe.core.circuit;

/**
 * Two's complement arithmetic by phase rotation in the Fourier basis.
 * <p>
 * Every operation takes extra control qubits: each phase rotation is additionally
 * controlled on all of them, so the operation is the identity unless they are all set.
 * Results wrap modulo {@code 2^n}.
 */
public final class QftArithmetic {
    private static final double TURN = 2 * Math.PI;

    private QftArithmetic() {
    }

    /**
     * {@code target += source}. The source may be narrower than the target, and is then zero-extended.
     *
     * @param c        The circuit.
     * @param target   The register to add into.
     * @param source   The register to add, which is not modified.
     * @param controls The extra controls.
     */
    public static void addInPlace(QuantumCircuit c, QubitRegister target, QubitRegister source, int... controls) {
        addScaled(c, target, source, 1, controls);
    }

    /**
     * {@code target -= source}.
     *
     * @param c        The circuit.
     * @param target   The register to subtract from.
     * @param source   The register to subtract, which is not modified.
     * @param controls The extra controls.
     */
    public static void subInPlace(QuantumCircuit c, QubitRegister target, QubitRegister source, int... controls) {
        addScaled(c, target, source, -1, controls);
    }

    private static void addScaled(QuantumCircuit c, QubitRegister target, QubitRegister source, int sign, int[] controls) {
        if (source.width() > target.width()) {
            throw new IllegalArgumentException("cannot add " + source + " into narrower " + target);
        }
        Qft.forward(c, target);
        for (int i = 0; i < target.width(); i++) {
            for (int j = 0; j <= i && j < source.width(); j++) {
                double angle = sign * TURN / (1L << (i - j + 1));
                c.applyControlledPhase(angle, QuantumCircuit.withControl(controls, source.qubit(j)), target.qubit(i));
            }
        }
        Qft.inverse(c, target);
    }

    /**
     * {@code target += value}.
     *
     * @param c        The circuit.
     * @param target   The register.
     * @param value    The classical addend, taken modulo {@code 2^n}.
     * @param controls The extra controls.
     */
    public static void addImmInPlace(QuantumCircuit c, QubitRegister target, long value, int... controls) {
        Qft.forward(c, target);
        for (int j = 0; j < target.width(); j++) {
            c.applyControlledPhase(turnFraction(value, j + 1), controls, target.qubit(j));
        }
        Qft.inverse(c, target);
    }

    public static void subImmInPlace(QuantumCircuit c, QubitRegister target, long value, int... controls) {
        addImmInPlace(c, target, -value, controls);
    }

    /**
     * {@code reg = -reg}, as bitwise complement plus one.
     *
     * @param c        The circuit.
     * @param reg      The register.
     * @param controls The extra controls.
     */
    public static void negateInPlace(QuantumCircuit c, QubitRegister reg, int... controls) {
        for (int i = 0; i < reg.width(); i++) {
            c.applyMcx(controls, reg.qubit(i));
        }
        addImmInPlace(c, reg, 1, controls);
    }

    /**
     * Copy a register into a fresh register, sign-extending it to a wider width.
     *
     * @param c     The circuit.
     * @param src   The register to copy.
     * @param width The width of the copy, at least that of {@code src}.
     * @param name  The name of the copy.
     * @return The copy.
     */
    public static QubitRegister copySignExtended(QuantumCircuit c, QubitRegister src, int width, String name) {
        QubitRegister out = c.allocate(name, width);
        for (int i = 0; i < width; i++) {
            c.applyCx(src.qubit(Math.min(i, src.width() - 1)), out.qubit(i));
        }
        return out;
    }

    /**
     * {@code a * b} into a fresh register of the same width.
     *
     * @param c        The circuit.
     * @param a        The left factor, not modified.
     * @param b        The right factor, not modified.
     * @param controls The extra controls.
     * @return The product register, zero if the controls are not all set.
     */
    public static QubitRegister mul(QuantumCircuit c, QubitRegister a, QubitRegister b, int... controls) {
        int n = a.width();
        if (b.width() != n) {
            throw new IllegalArgumentException("width mismatch: " + a + " * " + b);
        }
        QubitRegister out = c.allocate("prod", n);
        Qft.forward(c, out);
        for (int j = 1; j <= n; j++) {
            for (int i = 1; i <= n; i++) {
                for (int k = 1; k <= n; k++) {
                    int exp = i + j + k - 2 * n;
                    // rotations by whole turns vanish
                    if (exp <= 0) continue;
                    int[] ctrls = QuantumCircuit.withControl(
                            QuantumCircuit.withControl(controls, a.qubit(n - j)), b.qubit(n - i));
                    c.applyControlledPhase(TURN / (1L << exp), ctrls, out.qubit(k - 1));
                }
            }
        }
        Qft.inverse(c, out);
        return out;
    }

    /**
     * {@code a * factor} into a fresh register of the same width.
     *
     * @param c        The circuit.
     * @param a        The register, not modified.
     * @param factor   The classical factor.
     * @param controls The extra controls.
     * @return The product register, zero if the controls are not all set.
     */
    public static QubitRegister mulImm(QuantumCircuit c, QubitRegister a, long factor, int... controls) {
        int n = a.width();
        QubitRegister out = c.allocate("prod", n);
        Qft.forward(c, out);
        for (int j = 0; j < n; j++) {
            int[] ctrls = QuantumCircuit.withControl(controls, a.qubit(j));
            long scaled = factor << j;
            for (int k = 0; k < n; k++) {
                c.applyControlledPhase(turnFraction(scaled, k + 1), ctrls, out.qubit(k));
            }
        }
        Qft.inverse(c, out);
        return out;
    }

    /**
     * The angle {@code 2*pi*value / 2^bits}, reduced to under a turn.
     */
    private static double turnFraction(long value, int bits) {
        long modulus = 1L << bits;
        return TURN * Math.floorMod(value, modulus) / modulus;
    }
}
