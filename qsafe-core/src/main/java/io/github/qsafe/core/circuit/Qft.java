package io.github.qsafe.core.circuit;

/**
 * The quantum Fourier transform over a register, without the final qubit reversal.
 * <p>
 * After the forward transform of {@code |x>}, qubit {@code j} carries the phase
 * {@code 2*pi*x / 2^(j+1)}. Arithmetic adds to these phases, then transforms back.
 */
public final class Qft {
    private Qft() {
    }

    public static void forward(QuantumCircuit c, QubitRegister reg) {
        for (int j = reg.width() - 1; j >= 0; j--) {
            c.applyH(reg.qubit(j));
            for (int k = j - 1; k >= 0; k--) {
                c.applyControlledPhase(Math.PI / (1L << (j - k)), new int[]{reg.qubit(k)}, reg.qubit(j));
            }
        }
    }

    public static void inverse(QuantumCircuit c, QubitRegister reg) {
        for (int j = 0; j < reg.width(); j++) {
            for (int k = 0; k < j; k++) {
                c.applyControlledPhase(-Math.PI / (1L << (j - k)), new int[]{reg.qubit(k)}, reg.qubit(j));
            }
            c.applyH(reg.qubit(j));
        }
    }
}
