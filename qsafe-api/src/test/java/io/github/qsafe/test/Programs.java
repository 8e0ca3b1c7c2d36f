package io.github.qsafe.test;

import io.github.qsafe.core.ops.*;
import io.github.qsafe.core.ssa.*;

import java.util.Arrays;

/**
 * Small classical programs, built straight into IR.
 */
public class Programs {
    final Function func = new Function();
    final IRBuilder ib = new IRBuilder(func, func.newBb());

    BasicBlock newBb() {
        return ib.newBlock();
    }

    Programs at(BasicBlock block) {
        ib.setBlock(block);
        return this;
    }

    Var constant(long k) {
        return ib.insert(ClassicalOps.constant(k), "k");
    }

    Var arith(ArithOp op, Var lhs, Var rhs) {
        return ib.insert(ClassicalOps.arith(op, lhs, rhs), op.mnemonic);
    }

    Var arithImm(ArithOp op, Var lhs, long imm) {
        return ib.insert(ClassicalOps.arithImm(op, lhs, imm), op.mnemonic);
    }

    Var cmp(Predicate pred, Var lhs, Var rhs) {
        return ib.insert(ClassicalOps.cmp(pred, lhs, rhs), pred.mnemonic);
    }

    Var and(Var lhs, Var rhs) {
        return ib.insert(ClassicalOps.AND.insn(lhs, rhs), "and");
    }

    Var or(Var lhs, Var rhs) {
        return ib.insert(ClassicalOps.OR.insn(lhs, rhs), "or");
    }

    Var not(Var arg) {
        return ib.insert(ClassicalOps.NOT.insn(arg), "not");
    }

    Var phi(BasicBlock[] preds, Var... values) {
        return ib.insert(CommonOps.PHI.create(Arrays.asList(preds)).insn(values), "phi");
    }

    void br(BasicBlock target) {
        ib.insertCtrl(Control.br(target));
    }

    void condBr(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        ib.insertCtrl(ClassicalOps.condBr(cond, ifTrue, ifFalse));
    }

    void ret(Var... values) {
        ib.insertCtrl(Control.ret(values));
    }

    /**
     * {@code a op b}.
     */
    static Programs binary(ArithOp op, long a, long b) {
        Programs p = new Programs();
        p.ret(p.arith(op, p.constant(a), p.constant(b)));
        return p;
    }

    /**
     * <pre>
     * if (a < b) { a = a + b; b = b - 1 } else { a = a * 2 }
     * return a - b
     * </pre>
     */
    static Programs branchy(long a, long b) {
        Programs p = new Programs();
        BasicBlock then = p.newBb();
        BasicBlock otherwise = p.newBb();
        BasicBlock join = p.newBb();
        Var va = p.constant(a);
        Var vb = p.constant(b);
        p.condBr(p.cmp(Predicate.LT, va, vb), then, otherwise);

        Var sum = p.at(then).arith(ArithOp.ADD, va, vb);
        Var dec = p.arithImm(ArithOp.SUB, vb, 1);
        p.br(join);

        Var doubled = p.at(otherwise).arithImm(ArithOp.MUL, va, 2);
        p.br(join);

        BasicBlock[] preds = {then, otherwise};
        Var ra = p.at(join).phi(preds, sum, doubled);
        Var rb = p.phi(preds, dec, vb);
        p.ret(p.arith(ArithOp.SUB, ra, rb));
        return p;
    }

    /**
     * <pre>
     * r = a
     * if (a != 0 && !(b >= a)) { r = r * b; if (b == 2 || a < 0) r = r / b }
     * return r + 1
     * </pre>
     */
    static Programs nested(long a, long b) {
        Programs p = new Programs();
        BasicBlock outer = p.newBb();
        BasicBlock inner = p.newBb();
        BasicBlock innerJoin = p.newBb();
        BasicBlock join = p.newBb();
        BasicBlock entry = p.func.getEntry();
        Var va = p.constant(a);
        Var vb = p.constant(b);
        Var zero = p.constant(0);
        Var cond = p.and(p.cmp(Predicate.NE, va, zero), p.not(p.cmp(Predicate.GE, vb, va)));
        p.condBr(cond, outer, join);

        p.at(outer);
        Var prod = p.arith(ArithOp.MUL, va, vb);
        Var two = p.constant(2);
        p.condBr(p.or(p.cmp(Predicate.EQ, vb, two), p.cmp(Predicate.LT, va, zero)), inner, innerJoin);

        Var quot = p.at(inner).arith(ArithOp.DIV, prod, vb);
        p.br(innerJoin);

        Var r1 = p.at(innerJoin).phi(new BasicBlock[]{inner, outer}, quot, prod);
        p.br(join);

        Var r = p.at(join).phi(new BasicBlock[]{innerJoin, entry}, r1, va);
        p.ret(p.arithImm(ArithOp.ADD, r, 1));
        return p;
    }
}
