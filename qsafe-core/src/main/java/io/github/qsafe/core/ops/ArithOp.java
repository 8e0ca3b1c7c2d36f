package io.github.qsafe.core.ops;

/**
 * The arithmetic opcodes, shared by the classical and quantum-safe IR.
 */
public enum ArithOp {
    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/"),
    ;

    public final String mnemonic;
    public final String symbol;

    ArithOp(String mnemonic, String symbol) {
        this.mnemonic = mnemonic;
        this.symbol = symbol;
    }

    /**
     * Apply this operation to two signed integers, before any wrapping.
     * Division truncates toward zero.
     *
     * @param a The left operand.
     * @param b The right operand.
     * @return The result.
     * @throws ArithmeticException On division by zero.
     */
    public long apply(long a, long b) {
        switch (this) {
            // @formatter:off
            case ADD: return a + b;
            case SUB: return a - b;
            case MUL: return a * b;
            case DIV: return a / b;
            // @formatter:on
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
