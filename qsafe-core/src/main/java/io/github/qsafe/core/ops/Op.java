package io.github.qsafe.core.ops;

import io.github.qsafe.core.ext.DelegatingExtHolder;
import io.github.qsafe.core.ext.ExtContainer;
import io.github.qsafe.core.ssa.Insn;
import io.github.qsafe.core.ssa.Var;

import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Construct an instruction with this as its operation, applied to the given arguments.
     *
     * @param vars The arguments.
     * @return The instruction.
     */
    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    /**
     * Construct an instruction with this as its operation, applied to the given arguments.
     *
     * @param vars The arguments.
     * @return The instruction.
     */
    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}
