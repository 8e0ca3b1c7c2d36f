package io.github.qsafe.api;

import io.github.qsafe.core.circuit.CompiledCircuit;
import io.github.qsafe.core.ssa.Function;
import io.github.qsafe.core.util.Lazy;
import org.jetbrains.annotations.NotNull;

import static io.github.qsafe.core.util.Lazy.lazy;

/**
 * The compilation of a single classical function.
 * <p>
 * Stages are run lazily, in order:
 * <ol>
 *     <li>the function is {@link QuantumCompiler#translate(Function) translated} to quantum-safe IR,</li>
 *     <li>register constraints are {@link QuantumCompiler#enforce(Function) enforced} on it,</li>
 *     <li>it is {@link QuantumCompiler#toCircuit(Function) lowered} to a circuit.</li>
 * </ol>
 */
public class Compilation {
    private final QuantumCompiler cc;

    /**
     * The classical function being compiled.
     */
    @NotNull
    public final Function source;

    private final Lazy<Function> compiled;
    private final Lazy<CompiledCircuit> circuit;

    Compilation(QuantumCompiler cc, @NotNull Function source) {
        this.cc = cc;
        this.source = source;
        compiled = lazy(() -> cc.compile(source));
        circuit = lazy(() -> cc.toCircuit(compiled.get()));
    }

    /**
     * Get the quantum-safe function, with register constraints enforced.
     *
     * @return The function.
     */
    public Function getQuantumSafe() {
        return compiled.get();
    }

    public CompiledCircuit getCircuit() {
        return circuit.get();
    }

    /**
     * Simulate the circuit.
     *
     * @return The value the circuit most likely returns.
     */
    public long simulate() {
        return cc.simulate(getCircuit());
    }

    /**
     * Evaluate the source function classically, at the same width.
     *
     * @return The value it returns.
     */
    public long evaluateClassically() {
        return new ClassicalReference(cc.getConfig().getBitWidth()).evaluate(source);
    }
}
