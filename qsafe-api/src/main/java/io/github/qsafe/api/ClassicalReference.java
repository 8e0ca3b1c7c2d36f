package io.github.qsafe.api;

import io.github.qsafe.core.UndefinedValueException;
import io.github.qsafe.core.UnsupportedOpException;
import io.github.qsafe.core.ops.*;
import io.github.qsafe.core.ssa.*;
import io.github.qsafe.core.util.TwosComplement;
import org.apache.log4j.Logger;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.lang.reflect.InvocationTargetException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates classical functions on the JVM, with every integer wrapped to a fixed two's
 * complement width, as a reference for the circuits compiled from them.
 * <p>
 * A function is compiled to a class with a single {@code public static long run()} method.
 * Every value is held in a {@code long} local, booleans as 0 or 1. Phis are lowered to
 * stores on each incoming edge.
 */
public class ClassicalReference {
    private static final Logger LOGGER = Logger.getLogger(ClassicalReference.class);

    private static final Type TWOS_COMPLEMENT = Type.getType(TwosComplement.class);
    private static final Method WRAP = Method.getMethod("long wrap(long, int)");
    private static final Method RUN = Method.getMethod("long run()");

    private static int classCounter = 0;

    private final int width;

    public ClassicalReference(int width) {
        this.width = width;
    }

    /**
     * Compile a function to a class.
     *
     * @param func The classical function.
     * @return The class node.
     */
    public ClassNode compile(Function func) {
        ClassNode cn = new ClassNode();
        cn.visit(Opcodes.V1_8,
                Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL | Opcodes.ACC_SUPER,
                "io/github/qsafe/api/generated/Reference" + nextClassId(),
                null,
                "java/lang/Object",
                null);
        MethodNode mn = new MethodNode(Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC,
                RUN.getName(), RUN.getDescriptor(), null, null);
        cn.methods.add(mn);
        new Emitter(new GeneratorAdapter(mn, mn.access, mn.name, mn.desc), func).emit();
        cn.visitEnd();
        return cn;
    }

    /**
     * Compile and run a function.
     *
     * @param func The classical function.
     * @return The returned value, or 0 if it returns nothing.
     * @throws ArithmeticException If the function divides by zero.
     */
    public long evaluate(Function func) {
        ClassNode cn = compile(func);
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        cn.accept(cw);
        byte[] bytes = cw.toByteArray();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("compiled " + cn.name + " (" + bytes.length + " bytes)");
        }
        Class<?> clazz = new ReferenceClassLoader().defineClass(cn.name.replace('/', '.'), bytes);
        try {
            return (long) clazz.getMethod(RUN.getName()).invoke(null);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
    }

    private static synchronized int nextClassId() {
        return classCounter++;
    }

    private final class Emitter {
        final GeneratorAdapter ga;
        final Function func;
        final Map<Var, Integer> locals = new HashMap<>();
        final Map<BasicBlock, Label> labels = new HashMap<>();

        Emitter(GeneratorAdapter ga, Function func) {
            this.ga = ga;
            this.func = func;
        }

        void emit() {
            ga.visitCode();
            for (BasicBlock block : func.getBlocks()) {
                labels.put(block, new Label());
                for (Effect effect : block.getEffects()) {
                    for (Var var : effect.getAssignsTo()) {
                        int local = ga.newLocal(Type.LONG_TYPE);
                        locals.put(var, local);
                        // every local is written on entry, as not every path assigns every value
                        ga.push(0L);
                        ga.storeLocal(local);
                    }
                }
            }
            ga.goTo(labels.get(func.getEntry()));
            for (BasicBlock block : func.getBlocks()) {
                ga.mark(labels.get(block));
                for (Effect effect : block.getEffects()) {
                    emitEffect(effect);
                }
                emitControl(block);
            }
            ga.endMethod();
        }

        void load(Var var) {
            Integer local = locals.get(var);
            if (local == null) {
                throw new UndefinedValueException(var + " is never assigned");
            }
            ga.loadLocal(local);
        }

        void wrap() {
            ga.push(width);
            ga.invokeStatic(TWOS_COMPLEMENT, WRAP);
        }

        void emitEffect(Effect effect) {
            Insn insn = effect.insn();
            OpKey key = insn.op.key;
            if (key == CommonOps.PHI) {
                return;
            } else if (key == ClassicalOps.CONST) {
                ga.push(TwosComplement.checkRange(ClassicalOps.CONST.cast(insn.op).arg, width));
            } else if (key == ClassicalOps.ARITH) {
                load(insn.args().get(0));
                load(insn.args().get(1));
                emitArith(ClassicalOps.ARITH.cast(insn.op).arg);
                wrap();
            } else if (key == ClassicalOps.ARITH_IMM) {
                ArithImm arith = ClassicalOps.ARITH_IMM.cast(insn.op).arg;
                load(insn.args().get(0));
                ga.push(arith.imm);
                emitArith(arith.op);
                wrap();
            } else if (key == ClassicalOps.CMP) {
                emitCmp(ClassicalOps.CMP.cast(insn.op).arg, insn.args().get(0), insn.args().get(1));
            } else if (key == ClassicalOps.AND.key) {
                load(insn.args().get(0));
                load(insn.args().get(1));
                ga.math(GeneratorAdapter.AND, Type.LONG_TYPE);
            } else if (key == ClassicalOps.OR.key) {
                load(insn.args().get(0));
                load(insn.args().get(1));
                ga.math(GeneratorAdapter.OR, Type.LONG_TYPE);
            } else if (key == ClassicalOps.NOT.key) {
                load(insn.args().get(0));
                ga.push(1L);
                ga.math(GeneratorAdapter.XOR, Type.LONG_TYPE);
            } else {
                throw new UnsupportedOpException("cannot evaluate " + insn);
            }
            ga.storeLocal(locals.get(effect.result()));
        }

        void emitArith(ArithOp op) {
            int mathOp;
            switch (op) {
                // @formatter:off
                case ADD: mathOp = GeneratorAdapter.ADD; break;
                case SUB: mathOp = GeneratorAdapter.SUB; break;
                case MUL: mathOp = GeneratorAdapter.MUL; break;
                case DIV: mathOp = GeneratorAdapter.DIV; break;
                // @formatter:on
                default:
                    throw new UnsupportedOpException("cannot evaluate " + op);
            }
            ga.math(mathOp, Type.LONG_TYPE);
        }

        void emitCmp(Predicate pred, Var lhs, Var rhs) {
            int mode;
            switch (pred) {
                // @formatter:off
                case EQ: mode = GeneratorAdapter.EQ; break;
                case NE: mode = GeneratorAdapter.NE; break;
                case LT: mode = GeneratorAdapter.LT; break;
                case LE: mode = GeneratorAdapter.LE; break;
                case GT: mode = GeneratorAdapter.GT; break;
                case GE: mode = GeneratorAdapter.GE; break;
                // @formatter:on
                default:
                    throw new UnsupportedOpException("cannot evaluate " + pred);
            }
            Label isTrue = new Label();
            Label end = new Label();
            load(lhs);
            load(rhs);
            ga.ifCmp(Type.LONG_TYPE, mode, isTrue);
            ga.push(0L);
            ga.goTo(end);
            ga.mark(isTrue);
            ga.push(1L);
            ga.mark(end);
        }

        void emitControl(BasicBlock block) {
            Control ctrl = block.getControl();
            if (ctrl == null) {
                throw new IllegalStateException("block " + block.toTargetString() + " has no terminator");
            }
            Insn insn = ctrl.insn();
            if (insn.op.key == CommonOps.RETURN.key) {
                if (insn.args().isEmpty()) {
                    ga.push(0L);
                } else {
                    load(insn.args().get(0));
                }
                ga.returnValue();
            } else if (insn.op.key == CommonOps.BR.key) {
                jump(block, ctrl.targets.get(0));
            } else if (insn.op.key == ClassicalOps.COND_BR.key) {
                Label ifTrue = new Label();
                load(insn.args().get(0));
                ga.push(0L);
                ga.ifCmp(Type.LONG_TYPE, GeneratorAdapter.NE, ifTrue);
                jump(block, ctrl.targets.get(1));
                ga.mark(ifTrue);
                jump(block, ctrl.targets.get(0));
            } else {
                throw new UnsupportedOpException("cannot evaluate " + insn);
            }
        }

        void jump(BasicBlock from, BasicBlock to) {
            for (Effect effect : to.getEffects()) {
                if (effect.insn().op.key != CommonOps.PHI) continue;
                List<BasicBlock> preds = CommonOps.PHI.cast(effect.insn().op).arg;
                int i = preds.indexOf(from);
                if (i < 0) {
                    throw new UnsupportedOpException("phi " + effect + " has no value from "
                            + from.toTargetString());
                }
                load(effect.insn().args().get(i));
                ga.storeLocal(locals.get(effect.result()));
            }
            ga.goTo(labels.get(to));
        }
    }

    private static class ReferenceClassLoader extends ClassLoader {
        ReferenceClassLoader() {
            super(ClassicalReference.class.getClassLoader());
        }

        Class<?> defineClass(String name, byte[] bytes) {
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
