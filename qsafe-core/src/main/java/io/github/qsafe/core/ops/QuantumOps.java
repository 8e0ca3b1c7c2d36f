package io.github.qsafe.core.ops;

import io.github.qsafe.core.ssa.Insn;
import io.github.qsafe.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

/**
 * {@link Op}s and {@link OpKey}s of the quantum-safe IR.
 * <p>
 * Every value of this IR lives in a versioned register. {@link #INIT}, {@link #CMP},
 * {@link #AND}, {@link #OR} and {@link #NOT} write fresh registers. {@link #BINARY}
 * and {@link #BINARY_IMM} overwrite the register of their left operand, producing its
 * next version, and take an optional trailing control argument: with a false control
 * the result equals the left operand.
 */
public class QuantumOps {
    /**
     * Effect: a fresh register holding the constant.
     */
    public static final UnaryOpKey<Long> INIT = new UnaryOpKey<>("q.init");
    /**
     * Effect: {@code lhs (op)= rhs [if ctrl]}, in place.
     */
    public static final UnaryOpKey<ArithOp> BINARY = new UnaryOpKey<>("q.arith");
    /**
     * Effect: {@code lhs (op)= imm [if ctrl]}, in place.
     */
    public static final UnaryOpKey<ArithImm> BINARY_IMM = new UnaryOpKey<>("q.arith_imm");
    /**
     * Effect: a fresh boolean register holding the comparison of the two arguments.
     */
    public static final UnaryOpKey<Predicate> CMP = new UnaryOpKey<>("q.cmp");

    public static final Op AND = new SimpleOpKey("q.and").create();
    public static final Op OR = new SimpleOpKey("q.or").create();
    public static final Op NOT = new SimpleOpKey("q.not").create();

    public static Insn init(long value) {
        return INIT.create(value).insn();
    }

    public static Insn binary(ArithOp op, Var lhs, Var rhs, @Nullable Var ctrl) {
        UnaryOpKey<ArithOp>.UnaryOp o = BINARY.create(op);
        return ctrl == null ? o.insn(lhs, rhs) : o.insn(lhs, rhs, ctrl);
    }

    public static Insn binaryImm(ArithOp op, Var lhs, long imm, @Nullable Var ctrl) {
        UnaryOpKey<ArithImm>.UnaryOp o = BINARY_IMM.create(new ArithImm(op, imm));
        return ctrl == null ? o.insn(lhs) : o.insn(lhs, ctrl);
    }

    /**
     * Whether the instruction overwrites the register of its first argument.
     *
     * @param insn The instruction.
     * @return Whether it is an in-place operation.
     */
    public static boolean isInPlace(Insn insn) {
        return insn.op.key == BINARY || insn.op.key == BINARY_IMM;
    }

    /**
     * Get the control argument of an in-place operation.
     *
     * @param insn The instruction.
     * @return The control, or null if the operation is unconditional or not in-place.
     */
    @Nullable
    public static Var controlOf(Insn insn) {
        int principal;
        if (insn.op.key == BINARY) {
            principal = 2;
        } else if (insn.op.key == BINARY_IMM) {
            principal = 1;
        } else {
            return null;
        }
        return insn.args().size() > principal ? insn.args().get(principal) : null;
    }

    /**
     * Whether the instruction writes a fresh single-qubit boolean.
     *
     * @param insn The instruction.
     * @return Whether its result is a boolean.
     */
    public static boolean isBoolean(Insn insn) {
        OpKey key = insn.op.key;
        return key == CMP || key == AND.key || key == OR.key || key == NOT.key;
    }

    /**
     * Whether the instruction takes two principal operands, which must not be the same value.
     *
     * @param insn The instruction.
     * @return Whether the first two arguments are principal operands.
     */
    public static boolean hasTwoOperands(Insn insn) {
        OpKey key = insn.op.key;
        return key == BINARY || key == CMP || key == AND.key || key == OR.key;
    }
}
