package io.github.qsafe.core.ops;

import io.github.qsafe.core.ext.ExtHolder;

/**
 * An operation key, representing a kind of operation, without intermediates.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
