package io.github.qsafe.core.ssa;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ext.Ext;
import io.github.qsafe.core.ext.ExtHolder;
import io.github.qsafe.core.reg.Expr;
import io.github.qsafe.core.reg.RegisterRef;
import org.jetbrains.annotations.Nullable;

/**
 * A value. In classical IR, an SSA value; in quantum-safe IR, the contents of one
 * {@link RegisterRef register version}.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * The index of the variable, to distinguish from others with the same name in the same function.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '%' + name + (index == 0 ? "" : "." + index);
    }

    /**
     * Get the register this value lives in, which must be present.
     *
     * @return The register.
     */
    public RegisterRef register() {
        return getExtOrThrow(CommonExts.REGISTER);
    }

    // exts
    private Effect assignedAt = null;
    private RegisterRef register = null;
    private Expr definition = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        if (ext == CommonExts.REGISTER) {
            return (T) register;
        }
        if (ext == CommonExts.DEFINITION) {
            return (T) definition;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        if (ext == CommonExts.REGISTER) {
            register = (RegisterRef) value;
            return;
        }
        if (ext == CommonExts.DEFINITION) {
            definition = (Expr) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        if (ext == CommonExts.REGISTER) {
            register = null;
            return;
        }
        if (ext == CommonExts.DEFINITION) {
            definition = null;
            return;
        }
        super.removeExt(ext);
    }
}
