package io.github.qsafe.core.reg;

import io.github.qsafe.core.ops.ArithOp;
import io.github.qsafe.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

/**
 * The defining expression of a quantum-safe value, from which it can be recomputed
 * into fresh registers once its own register has been overwritten.
 * <p>
 * Expressions compare by identity: two structurally equal expressions may denote
 * different values of the input program.
 */
public abstract class Expr {
    private Expr() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitConst(Const expr);

        R visitBinary(BinaryOf expr);

        R visitBinaryImm(BinaryImmOf expr);
    }

    /**
     * A constant, of the given width.
     */
    public static final class Const extends Expr {
        public final long value;
        public final int width;

        public Const(long value, int width) {
            this.value = value;
            this.width = width;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * {@code lhs op rhs}, or just {@code lhs} if the control is present and false.
     */
    public static final class BinaryOf extends Expr {
        public final ArithOp op;
        public final Expr lhs;
        public final Expr rhs;
        @Nullable
        public final Var control;

        public BinaryOf(ArithOp op, Expr lhs, Expr rhs, @Nullable Var control) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
            this.control = control;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.symbol + " " + rhs + (control == null ? "" : " if " + control) + ")";
        }
    }

    /**
     * {@code lhs op imm}, or just {@code lhs} if the control is present and false.
     */
    public static final class BinaryImmOf extends Expr {
        public final ArithOp op;
        public final Expr lhs;
        public final long imm;
        @Nullable
        public final Var control;

        public BinaryImmOf(ArithOp op, Expr lhs, long imm, @Nullable Var control) {
            this.op = op;
            this.lhs = lhs;
            this.imm = imm;
            this.control = control;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryImm(this);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.symbol + " " + imm + (control == null ? "" : " if " + control) + ")";
        }
    }
}
