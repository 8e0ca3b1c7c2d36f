package io.github.qsafe.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} which falls back to another container for exts it does not have.
 * <p>
 * An instruction delegates to its operation, and an operation to its key, so a
 * property of a whole op kind (e.g. {@link CommonExts#IS_PURE}) is visible from
 * every instruction using it.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T value = super.getNullable(ext);
        if (value != null) return value;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
