package io.github.qsafe.core.circuit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of gates over qubits, which are allocated in named registers and start at zero.
 */
public class QuantumCircuit {
    /**
     * Phase rotations closer than this to a multiple of a full turn are dropped.
     */
    private static final double ANGLE_EPSILON = 1e-12;
    private static final double TURN = 2 * Math.PI;

    private final List<QubitRegister> registers = new ArrayList<>();
    private final List<Gate> gates = new ArrayList<>();
    private int qubitCount = 0;

    /**
     * Allocate a fresh register of qubits, all zero.
     *
     * @param name  The name of the register. A suffix is appended if it is taken.
     * @param width The number of qubits.
     * @return The register.
     */
    public QubitRegister allocate(String name, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        String unique = name;
        int suffix = 0;
        while (hasRegister(unique)) {
            unique = name + ++suffix;
        }
        QubitRegister reg = new QubitRegister(unique, qubitCount, width);
        qubitCount += width;
        registers.add(reg);
        return reg;
    }

    private boolean hasRegister(String name) {
        for (QubitRegister register : registers) {
            if (register.name.equals(name)) return true;
        }
        return false;
    }

    public void applyX(int qubit) {
        add(new Gate(Gate.Kind.X, new int[0], new int[]{qubit}, 0));
    }

    public void applyH(int qubit) {
        add(new Gate(Gate.Kind.H, new int[0], new int[]{qubit}, 0));
    }

    /**
     * Apply a phase rotation to the target, controlled on every control qubit.
     * Rotations by a multiple of a full turn are identities, and are not recorded.
     *
     * @param angle    The angle, in radians.
     * @param controls The control qubits, possibly none.
     * @param target   The target qubit.
     */
    public void applyControlledPhase(double angle, int[] controls, int target) {
        double reduced = angle % TURN;
        if (Math.abs(reduced) < ANGLE_EPSILON || Math.abs(Math.abs(reduced) - TURN) < ANGLE_EPSILON) {
            return;
        }
        add(new Gate(Gate.Kind.PHASE, controls.clone(), new int[]{target}, angle));
    }

    /**
     * Flip the target, controlled on every control qubit. With no controls this is an X gate.
     *
     * @param controls The control qubits.
     * @param target   The target qubit.
     */
    public void applyMcx(int[] controls, int target) {
        if (controls.length == 0) {
            applyX(target);
        } else {
            add(new Gate(Gate.Kind.MCX, controls.clone(), new int[]{target}, 0));
        }
    }

    public void applyCx(int control, int target) {
        applyMcx(new int[]{control}, target);
    }

    public void applySwap(int a, int b) {
        add(new Gate(Gate.Kind.SWAP, new int[0], new int[]{a, b}, 0));
    }

    /**
     * Set a register, which must be zero, to a two's complement value with X gates.
     *
     * @param reg  The register.
     * @param bits The bits, least significant first.
     */
    public void load(QubitRegister reg, boolean[] bits) {
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) applyX(reg.qubit(i));
        }
    }

    private void add(Gate gate) {
        for (int c : gate.controls()) checkQubit(c);
        for (int t : gate.getTargets()) {
            checkQubit(t);
            for (int c : gate.controls()) {
                if (c == t) {
                    throw new IllegalArgumentException("qubit " + t + " is both control and target of " + gate);
                }
            }
        }
        gates.add(gate);
    }

    private void checkQubit(int qubit) {
        if (qubit < 0 || qubit >= qubitCount) {
            throw new IndexOutOfBoundsException("qubit " + qubit + " of " + qubitCount);
        }
    }

    public List<Gate> getGates() {
        return Collections.unmodifiableList(gates);
    }

    public List<QubitRegister> getRegisters() {
        return Collections.unmodifiableList(registers);
    }

    public int getQubitCount() {
        return qubitCount;
    }

    /**
     * Append a control qubit to a set of controls.
     *
     * @param controls The controls.
     * @param extra    The extra control.
     * @return The combined controls.
     */
    public static int[] withControl(int[] controls, int extra) {
        int[] all = Arrays.copyOf(controls, controls.length + 1);
        all[controls.length] = extra;
        return all;
    }

    @Override
    public String toString() {
        return "circuit(" + qubitCount + " qubits, " + gates.size() + " gates)";
    }
}
