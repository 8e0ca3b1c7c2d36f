package io.github.qsafe.core.circuit;

/**
 * A named, contiguous range of qubits in a {@link QuantumCircuit}. Qubit 0 is the least significant.
 */
public final class QubitRegister {
    public final String name;
    private final int offset;
    private final int width;

    QubitRegister(String name, int offset, int width) {
        this.name = name;
        this.offset = offset;
        this.width = width;
    }

    public int width() {
        return width;
    }

    /**
     * Get the circuit-wide index of a qubit of this register.
     *
     * @param i The position in the register.
     * @return The qubit index.
     */
    public int qubit(int i) {
        if (i < 0 || i >= width) {
            throw new IndexOutOfBoundsException("qubit " + i + " of " + this);
        }
        return offset + i;
    }

    /**
     * Get the most significant qubit, the sign bit of two's complement values.
     *
     * @return The qubit index.
     */
    public int msb() {
        return qubit(width - 1);
    }

    @Override
    public String toString() {
        return name + "[" + width + "]";
    }
}
