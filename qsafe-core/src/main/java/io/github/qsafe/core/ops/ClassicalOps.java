package io.github.qsafe.core.ops;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ssa.BasicBlock;
import io.github.qsafe.core.ssa.Control;
import io.github.qsafe.core.ssa.Insn;
import io.github.qsafe.core.ssa.Var;

/**
 * {@link Op}s and {@link OpKey}s of the classical arithmetic IR, the input of the compiler.
 * <p>
 * Integer values are signed and wrap to the configured width. Booleans are produced
 * only by {@link #CMP}, {@link #AND}, {@link #OR} and {@link #NOT}, and consumed only
 * by those and {@link #COND_BR}.
 */
public class ClassicalOps {
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Long> CONST = new UnaryOpKey<>("const");
    /**
     * Effect: applies the operation to its two integer arguments.
     */
    public static final UnaryOpKey<ArithOp> ARITH = new UnaryOpKey<>("arith");
    /**
     * Effect: applies the operation to its integer argument and the immediate.
     */
    public static final UnaryOpKey<ArithImm> ARITH_IMM = new UnaryOpKey<>("arith_imm");
    /**
     * Effect: compares its two integer arguments, returning a boolean.
     */
    public static final UnaryOpKey<Predicate> CMP = new UnaryOpKey<>("cmp");

    public static final Op AND = new SimpleOpKey("and").create();
    public static final Op OR = new SimpleOpKey("or").create();
    public static final Op NOT = new SimpleOpKey("not").create();

    /**
     * Control: jumps to the first target if its boolean argument is true, the second otherwise.
     */
    public static final Op COND_BR = new SimpleOpKey("cond_br").create();

    static {
        for (OpKey key : new OpKey[]{
                CONST,
                ARITH,
                ARITH_IMM,
                CMP,
                AND.key,
                OR.key,
                NOT.key,
        }) {
            key.attachExt(CommonExts.IS_PURE, true);
        }
    }

    public static Insn constant(long k) {
        return CONST.create(k).insn();
    }

    public static Insn arith(ArithOp op, Var lhs, Var rhs) {
        return ARITH.create(op).insn(lhs, rhs);
    }

    public static Insn arithImm(ArithOp op, Var lhs, long imm) {
        return ARITH_IMM.create(new ArithImm(op, imm)).insn(lhs);
    }

    public static Insn cmp(Predicate pred, Var lhs, Var rhs) {
        return CMP.create(pred).insn(lhs, rhs);
    }

    /**
     * Construct a conditional jump.
     *
     * @param cond     The boolean condition.
     * @param ifTrue   The block to jump to if the condition holds.
     * @param ifFalse  The block to jump to otherwise.
     * @return The control instruction.
     */
    public static Control condBr(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return COND_BR.insn(cond).jumpsTo(ifTrue, ifFalse);
    }
}
