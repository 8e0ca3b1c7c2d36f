package io.github.qsafe.core.reg;

import io.github.qsafe.core.StructuralViolationException;
import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Effect;
import io.github.qsafe.core.ssa.Function;
import io.github.qsafe.core.ssa.Var;

import java.util.HashMap;
import java.util.Map;

/**
 * Register id and version counters for the compilation of one function.
 */
public final class RegisterAllocator {
    private int nextId;
    private final Map<Integer, Integer> latest = new HashMap<>();

    public RegisterAllocator() {
        this(0);
    }

    private RegisterAllocator(int firstId) {
        this.nextId = firstId;
    }

    /**
     * Create an allocator whose fresh ids do not collide with any register used in the function.
     *
     * @param func The quantum-safe function.
     * @return The allocator.
     */
    public static RegisterAllocator after(Function func) {
        int max = -1;
        for (BasicBlock block : func.getBlocks()) {
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    RegisterRef ref = var.getNullable(CommonExts.REGISTER);
                    if (ref != null) max = Math.max(max, ref.registerId);
                }
            }
        }
        return new RegisterAllocator(max + 1);
    }

    /**
     * Allocate a fresh register id. The returned version 0 is not yet {@link #produced(RegisterRef) produced}.
     *
     * @param width The width of the register.
     * @param path  The path of the value, empty if it is not a copy.
     * @return The reference to the first version.
     */
    public RegisterRef fresh(int width, String path) {
        int id = nextId++;
        return new RegisterRef(id, 0, path, width);
    }

    /**
     * Record a version as produced by an operation that does not overwrite a register.
     *
     * @param ref The version.
     * @throws StructuralViolationException If the version was already produced.
     */
    public void produced(RegisterRef ref) {
        if (isProduced(ref)) {
            throw new StructuralViolationException("register version " + ref + " is produced more than once");
        }
        latest.put(ref.registerId, ref.version);
        nextId = Math.max(nextId, ref.registerId + 1);
    }

    /**
     * Produce the next version of the register {@code lhs} is a version of, overwriting it.
     *
     * @param lhs The version being overwritten.
     * @return The next version.
     * @throws StructuralViolationException If {@code lhs} is not the latest version of its register.
     */
    public RegisterRef overwrite(RegisterRef lhs) {
        if (!isCurrent(lhs)) {
            throw new StructuralViolationException("overwriting " + lhs
                    + ", but the register is at version " + latest.get(lhs.registerId));
        }
        RegisterRef next = lhs.next();
        latest.put(next.registerId, next.version);
        return next;
    }

    /**
     * Whether {@code ref} is the latest version of its register, so has not been overwritten.
     *
     * @param ref The version.
     * @return Whether it is current.
     */
    public boolean isCurrent(RegisterRef ref) {
        Integer cur = latest.get(ref.registerId);
        return cur != null && cur == ref.version;
    }

    /**
     * Whether {@code ref}, or a later version of its register, has been produced.
     *
     * @param ref The version.
     * @return Whether it is produced.
     */
    public boolean isProduced(RegisterRef ref) {
        Integer cur = latest.get(ref.registerId);
        return cur != null && cur >= ref.version;
    }
}
