package io.github.qsafe.core.ops;

/**
 * Signed integer comparison predicates.
 * <p>
 * Every predicate reduces to {@link #LT} or {@link #EQ}, possibly with swapped
 * operands and a negated result: {@code le = !gt}, {@code ge = !lt}, {@code ne = !eq}.
 */
public enum Predicate {
    EQ("eq"),
    NE("ne"),
    LT("lt"),
    LE("le"),
    GT("gt"),
    GE("ge"),
    ;

    public final String mnemonic;

    Predicate(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public boolean test(long a, long b) {
        switch (this) {
            // @formatter:off
            case EQ: return a == b;
            case NE: return a != b;
            case LT: return a < b;
            case LE: return a <= b;
            case GT: return a > b;
            case GE: return a >= b;
            // @formatter:on
            default:
                throw new IllegalStateException();
        }
    }

    /**
     * Get the base predicate, either {@link #LT} or {@link #EQ}.
     *
     * @return The base predicate.
     */
    public Predicate base() {
        return this == EQ || this == NE ? EQ : LT;
    }

    /**
     * Get whether the operands are swapped before evaluating {@link #base()}.
     *
     * @return Whether to swap.
     */
    public boolean swapsOperands() {
        return this == GT || this == LE;
    }

    /**
     * Get whether the result of {@link #base()} is negated.
     *
     * @return Whether to negate.
     */
    public boolean negatesResult() {
        return this == NE || this == LE || this == GE;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
