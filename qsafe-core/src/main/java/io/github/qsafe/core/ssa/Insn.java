package io.github.qsafe.core.ssa;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ext.DelegatingExtHolder;
import io.github.qsafe.core.ext.Ext;
import io.github.qsafe.core.ext.ExtContainer;
import io.github.qsafe.core.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An instruction: an {@link Op} applied to some arguments.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    public static boolean TRACK_INSN_CREATIONS = System.getenv("QSAFE_TRACK_INSN_CREATIONS") != null;

    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public final Op op;
    private final Var[] args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = args.toArray(new Var[0]);
        for (Var arg : this.args) {
            Objects.requireNonNull(arg, "argument");
        }
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    /**
     * Get the arguments of this instruction, as an unmodifiable list.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return Collections.unmodifiableList(Arrays.asList(args));
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args().iterator();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
