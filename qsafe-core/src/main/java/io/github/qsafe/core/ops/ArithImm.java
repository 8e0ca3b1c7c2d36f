package io.github.qsafe.core.ops;

import java.util.Objects;

/**
 * The intermediate of a binary operation with an immediate right operand.
 */
public final class ArithImm {
    public final ArithOp op;
    public final long imm;

    public ArithImm(ArithOp op, long imm) {
        this.op = op;
        this.imm = imm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArithImm that = (ArithImm) o;
        return imm == that.imm && op == that.op;
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, imm);
    }

    @Override
    public String toString() {
        return op + " " + imm;
    }
}
