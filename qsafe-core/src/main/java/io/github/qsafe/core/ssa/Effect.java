package io.github.qsafe.core.ssa;

import io.github.qsafe.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo;
    private final Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = Collections.unmodifiableList(new ArrayList<>(assignsTo));
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        switch (assignsTo.size()) {
            case 0:
                break;
            case 1:
                sb.append(assignsTo.get(0)).append(" = ");
                break;
            default:
                sb.append(assignsTo.stream()
                        .map(Objects::toString)
                        .collect(Collectors.joining(", ", "", " = ")));
                break;
        }
        sb.append(insn);
        return sb.toString();
    }

    /**
     * Get the list of variables this effect assigns to.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    /**
     * Get the single variable this effect assigns to.
     *
     * @return The variable.
     * @throws IllegalStateException If the effect does not assign exactly one variable.
     */
    public Var result() {
        if (assignsTo.size() != 1) {
            throw new IllegalStateException("effect assigns " + assignsTo.size() + " values: " + this);
        }
        return assignsTo.get(0);
    }

    public Insn insn() {
        return insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
