package io.github.qsafe.core.circuit;

import io.github.qsafe.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;

/**
 * A circuit compiled from a quantum-safe function, with the physical register that held each value.
 */
public final class CompiledCircuit {
    private final QuantumCircuit circuit;
    private final Map<Var, QubitRegister> registers;
    @Nullable
    private final QubitRegister returned;
    private final boolean returnsBoolean;
    private final int width;

    public CompiledCircuit(QuantumCircuit circuit,
                           Map<Var, QubitRegister> registers,
                           @Nullable QubitRegister returned,
                           boolean returnsBoolean,
                           int width) {
        this.circuit = circuit;
        this.registers = Collections.unmodifiableMap(registers);
        this.returned = returned;
        this.returnsBoolean = returnsBoolean;
        this.width = width;
    }

    public QuantumCircuit getCircuit() {
        return circuit;
    }

    /**
     * Get the physical register a value was written to. A register may hold later
     * versions of the same logical register once the circuit has run to the end.
     *
     * @param var The quantum-safe value.
     * @return The register, or null if the value is not from the compiled function.
     */
    @Nullable
    public QubitRegister registerOf(Var var) {
        return registers.get(var);
    }

    public Map<Var, QubitRegister> getRegisters() {
        return registers;
    }

    /**
     * Get the register holding the returned value.
     *
     * @return The register, or null if the function returns nothing.
     */
    @Nullable
    public QubitRegister getReturned() {
        return returned;
    }

    /**
     * Whether the returned value is a comparison or boolean combination, rather than an integer.
     *
     * @return Whether the function returns a boolean.
     */
    public boolean returnsBoolean() {
        return returnsBoolean;
    }

    /**
     * Decode the returned value from a simulation of this circuit. Booleans decode as 0 or 1,
     * integers as two's complement.
     *
     * @param result The simulation result.
     * @return The returned value.
     * @throws IllegalStateException If the function returns nothing.
     */
    public long readReturned(SimulationResult result) {
        if (returned == null) {
            throw new IllegalStateException("circuit returns nothing");
        }
        if (returnsBoolean) {
            return result.measureBoolean(returned) ? 1 : 0;
        }
        return result.measureSigned(returned);
    }

    /**
     * The width of the integer registers.
     *
     * @return The width.
     */
    public int getWidth() {
        return width;
    }

    @Override
    public String toString() {
        return "CompiledCircuit{" + circuit.getQubitCount() + " qubits, "
                + circuit.getGates().size() + " gates, returns " + returned + "}";
    }
}
