package io.github.qsafe.core.ssa;

import io.github.qsafe.core.ext.CommonExts;
import io.github.qsafe.core.ext.Ext;
import io.github.qsafe.core.ext.ExtContainer;
import io.github.qsafe.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block, encapsulating a list of {@link Effect} instructions,
 * followed by exactly one {@link Control} instruction at the end.
 */
public final class BasicBlock extends ExtHolder {
    private final List<Effect> effects = new ArrayList<>();
    private Control control;
    /**
     * The position of this block in its function, in creation order.
     */
    public final int index;

    BasicBlock(int index) {
        this.index = index;
    }

    /**
     * Format this block as a jump target.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "@b" + index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    private <T extends ExtContainer> T registerWithThis(T extable) {
        if (extable != null) {
            extable.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        return extable;
    }

    /**
     * Get the {@link Effect effects} in this basic block, as an unmodifiable list.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return Collections.unmodifiableList(effects);
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        effects.add(registerWithThis(effect));
    }

    /**
     * Remove all effects from this block.
     */
    public void clearEffects() {
        for (Effect effect : effects) {
            effect.removeExt(CommonExts.OWNING_BLOCK);
        }
        effects.clear();
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        this.control = registerWithThis(control);
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
