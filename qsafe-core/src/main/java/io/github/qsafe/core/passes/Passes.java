package io.github.qsafe.core.passes;

import io.github.qsafe.core.circuit.CompiledCircuit;
import io.github.qsafe.core.passes.convert.QuantumToCircuit;
import io.github.qsafe.core.passes.form.EnforceConstraints;
import io.github.qsafe.core.passes.meta.VerifyConstraints;
import io.github.qsafe.core.ssa.Function;

public class Passes {
    public static final IRPass<Function, Function> ENFORCE =
            EnforceConstraints.INSTANCE
                    .then(VerifyConstraints.INSTANCE);

    public static final IRPass<Function, CompiledCircuit> LOWER =
            ENFORCE.then(QuantumToCircuit.INSTANCE);
}
