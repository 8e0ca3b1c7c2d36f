package io.github.qsafe.api;

import io.github.qsafe.core.circuit.CompiledCircuit;
import io.github.qsafe.core.circuit.QubitRegister;
import io.github.qsafe.core.circuit.SimulationResult;
import io.github.qsafe.core.circuit.StateVectorSimulator;
import io.github.qsafe.core.conf.CompilerConfig;
import io.github.qsafe.core.passes.IRPass;
import io.github.qsafe.core.passes.Passes;
import io.github.qsafe.core.passes.convert.ClassicalToQuantum;
import io.github.qsafe.core.passes.convert.QuantumToCircuit;
import io.github.qsafe.core.passes.form.EnforceConstraints;
import io.github.qsafe.core.ssa.Function;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Compiles classical functions to quantum-safe IR, and from there to circuits.
 * <p>
 * Each stage is available separately, or {@link #submit(Function) all together}.
 */
public class QuantumCompiler {
    private static final Logger LOGGER = Logger.getLogger(QuantumCompiler.class);

    private final CompilerConfig config;
    private final IRPass<Function, Function> enforce;

    public QuantumCompiler(CompilerConfig config) {
        this.config = config;
        this.enforce = config.isVerify() ? Passes.ENFORCE : EnforceConstraints.INSTANCE;
    }

    public QuantumCompiler() {
        this(CompilerConfig.DEFAULT);
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * Translate a classical function to a straight-line quantum-safe function.
     *
     * @param func The classical function, which is not modified.
     * @return The quantum-safe function.
     */
    @Contract(pure = true)
    public Function translate(Function func) {
        return new ClassicalToQuantum(config).run(func);
    }

    /**
     * Rewrite a quantum-safe function in place until every register constraint holds.
     *
     * @param func The quantum-safe function.
     * @return The same function.
     */
    public Function enforce(Function func) {
        return enforce.run(func);
    }

    /**
     * Translate a classical function, and enforce register constraints on the result.
     *
     * @param func The classical function.
     * @return The quantum-safe function.
     */
    @Contract(pure = true)
    public Function compile(Function func) {
        return enforce(translate(func));
    }

    /**
     * Lower a quantum-safe function, whose register constraints hold, to a circuit.
     *
     * @param func The quantum-safe function.
     * @return The circuit.
     */
    public CompiledCircuit toCircuit(Function func) {
        return QuantumToCircuit.INSTANCE.run(func);
    }

    /**
     * Simulate a circuit, and decode the most likely value of its returned register.
     *
     * @param circuit The circuit.
     * @return The signed value, or 0 or 1 if the function returns a boolean.
     * @throws IllegalArgumentException If the circuit returns nothing.
     */
    public long simulate(CompiledCircuit circuit) {
        QubitRegister returned = circuit.getReturned();
        if (returned == null) {
            throw new IllegalArgumentException("circuit returns nothing");
        }
        SimulationResult result = new StateVectorSimulator().run(circuit.getCircuit());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("simulated " + circuit + " with " + result.getStateCount()
                    + " basis state(s), most likely with probability " + result.getMostLikelyProbability());
        }
        return circuit.readReturned(result);
    }

    /**
     * Start compiling a classical function. Every stage is run the first time its result is requested.
     *
     * @param func The classical function.
     * @return The compilation.
     */
    @Contract(pure = true)
    @NotNull
    public Compilation submit(Function func) {
        return new Compilation(this, func);
    }
}
