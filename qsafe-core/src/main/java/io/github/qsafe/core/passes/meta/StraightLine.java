package io.github.qsafe.core.passes.meta;

import io.github.qsafe.core.UnsupportedOpException;
import io.github.qsafe.core.ops.CommonOps;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Function;

/**
 * Access to the single block of quantum-safe code, which is always straight-line.
 */
public final class StraightLine {
    private StraightLine() {
    }

    /**
     * Get the only block of a function, which must end in a return.
     *
     * @param func The function.
     * @return The block.
     * @throws UnsupportedOpException If the function branches.
     */
    public static BasicBlock blockOf(Function func) {
        if (func.getBlocks().size() != 1) {
            throw new UnsupportedOpException("quantum-safe code must be a single block, found "
                    + func.getBlocks().size());
        }
        BasicBlock block = func.getEntry();
        if (block.getControl() == null || block.getControl().insn().op != CommonOps.RETURN) {
            throw new UnsupportedOpException("quantum-safe code must end with a return, found "
                    + block.getControl());
        }
        return block;
    }
}
