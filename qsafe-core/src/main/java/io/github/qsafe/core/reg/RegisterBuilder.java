package io.github.qsafe.core.reg;

import io.github.qsafe.core.StructuralViolationException;
import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ops.ArithOp;
import io.github.qsafe.core.ops.Predicate;
import io.github.qsafe.core.ops.QuantumOps;
import io.github.qsafe.core.ssa.Control;
import io.github.qsafe.core.ssa.IRBuilder;
import io.github.qsafe.core.ssa.Insn;
import io.github.qsafe.core.ssa.Var;
import io.github.qsafe.core.util.TwosComplement;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Builds quantum-safe operations at the end of a block, assigning each result its
 * register version.
 * <p>
 * Every operation is checked as it is inserted: in-place operations must write the
 * next version of their left operand's register, which must not have been
 * overwritten yet, no version may be produced twice, and no operation may take
 * the same register version as both of its principal operands. A failed check
 * throws {@link StructuralViolationException}.
 */
public class RegisterBuilder {
    private static final Logger LOGGER = Logger.getLogger(RegisterBuilder.class);

    private final IRBuilder ib;
    private final RegisterAllocator alloc;

    public RegisterBuilder(IRBuilder ib, RegisterAllocator alloc) {
        this.ib = ib;
        this.alloc = alloc;
    }

    public IRBuilder getIRBuilder() {
        return ib;
    }

    public RegisterAllocator getAllocator() {
        return alloc;
    }

    /**
     * Create a variable for a register version, without producing it.
     *
     * @param ref The version.
     * @return The variable.
     */
    public Var newValue(RegisterRef ref) {
        Var var = ib.func.newVar(ref.toVarName());
        var.attachExt(CommonExts.REGISTER, ref);
        return var;
    }

    /**
     * Insert an instruction assigning to an existing variable, checking the register constraints.
     *
     * @param insn   The instruction.
     * @param result The variable, which must have a register.
     * @return The variable.
     */
    public Var insert(Insn insn, Var result) {
        RegisterRef ref = result.register();
        if (QuantumOps.isInPlace(insn)) {
            RegisterRef lhs = insn.args().get(0).register();
            if (ref.registerId != lhs.registerId || ref.version != lhs.version + 1) {
                throw new StructuralViolationException("in-place operation " + insn
                        + " must write " + lhs.next() + ", not " + ref);
            }
            alloc.overwrite(lhs);
        } else {
            alloc.produced(ref);
        }
        if (QuantumOps.hasTwoOperands(insn)) {
            RegisterRef lhs = insn.args().get(0).register();
            RegisterRef rhs = insn.args().get(1).register();
            if (lhs.equals(rhs)) {
                throw new StructuralViolationException("operation " + insn + " reads " + lhs + " twice");
            }
            if (lhs.width != rhs.width) {
                throw new StructuralViolationException("operation " + insn + " mixes widths "
                        + lhs.width + " and " + rhs.width);
            }
        }
        ib.insert(insn, result);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("emit " + result + " = " + insn);
        }
        return result;
    }

    /**
     * Initialise a fresh register with a constant.
     *
     * @param value The value.
     * @param width The width of the register.
     * @param path  The path, empty unless the register is a copy of another.
     * @return The value.
     */
    public Var init(long value, int width, String path) {
        TwosComplement.checkRange(value, width);
        Var var = insert(QuantumOps.init(value), newValue(alloc.fresh(width, path)));
        var.attachExt(CommonExts.DEFINITION, new Expr.Const(value, width));
        return var;
    }

    public Var binary(ArithOp op, Var lhs, Var rhs, @Nullable Var ctrl) {
        Var var = insert(QuantumOps.binary(op, lhs, rhs, ctrl), newValue(lhs.register().next()));
        Expr l = lhs.getNullable(CommonExts.DEFINITION);
        Expr r = rhs.getNullable(CommonExts.DEFINITION);
        if (l != null && r != null) {
            var.attachExt(CommonExts.DEFINITION, new Expr.BinaryOf(op, l, r, ctrl));
        }
        return var;
    }

    public Var binaryImm(ArithOp op, Var lhs, long imm, @Nullable Var ctrl) {
        TwosComplement.checkRange(imm, lhs.register().width);
        Var var = insert(QuantumOps.binaryImm(op, lhs, imm, ctrl), newValue(lhs.register().next()));
        Expr l = lhs.getNullable(CommonExts.DEFINITION);
        if (l != null) {
            var.attachExt(CommonExts.DEFINITION, new Expr.BinaryImmOf(op, l, imm, ctrl));
        }
        return var;
    }

    /**
     * Copy a value into a fresh register, as {@code 0 + src}.
     *
     * @param src The value to copy.
     * @param tag The path tag of the copy, such as {@code "d"} for duplicates.
     * @return The copy.
     */
    public Var copy(Var src, String tag) {
        RegisterRef ref = src.register();
        Var zero = init(0, ref.width, tag + ref.registerId + "." + ref.version);
        return binary(ArithOp.ADD, zero, src, null);
    }

    public Var cmp(Predicate pred, Var lhs, Var rhs) {
        return insert(QuantumOps.CMP.create(pred).insn(lhs, rhs), newValue(alloc.fresh(1, "")));
    }

    public Var and(Var lhs, Var rhs) {
        return insert(QuantumOps.AND.insn(lhs, rhs), newValue(alloc.fresh(1, "")));
    }

    public Var or(Var lhs, Var rhs) {
        return insert(QuantumOps.OR.insn(lhs, rhs), newValue(alloc.fresh(1, "")));
    }

    public Var not(Var arg) {
        return insert(QuantumOps.NOT.insn(arg), newValue(alloc.fresh(1, "")));
    }

    /**
     * End the block with a return.
     *
     * @param value The returned value, or null.
     */
    public void ret(@Nullable Var value) {
        ib.insertCtrl(value == null ? Control.ret() : Control.ret(value));
    }
}
