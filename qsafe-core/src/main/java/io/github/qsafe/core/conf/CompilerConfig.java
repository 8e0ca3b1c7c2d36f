package io.github.qsafe.core.conf;

/**
 * Settings for compiling classical functions to quantum-safe IR and circuits.
 * Instances should be created with {@link #builder()}, and are immutable.
 */
public final class CompilerConfig {
    public static final int DEFAULT_BIT_WIDTH = 4;
    /**
     * The widest registers supported, so that every intermediate of a classical
     * evaluation fits in a {@code long}.
     */
    public static final int MAX_BIT_WIDTH = 31;

    /**
     * The default configuration: {@value #DEFAULT_BIT_WIDTH}-bit registers, with verification.
     */
    public static final CompilerConfig DEFAULT = builder().build();

    private final int bitWidth;
    private final boolean verify;

    private CompilerConfig(Builder builder) {
        this.bitWidth = builder.bitWidth;
        this.verify = builder.verify;
    }

    /**
     * Start a {@link Builder} for a configuration.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the width of every integer register, in bits.
     *
     * @return The width.
     */
    public int getBitWidth() {
        return bitWidth;
    }

    /**
     * Get whether enforced code is checked against every register constraint before it is used.
     *
     * @return Whether to verify.
     */
    public boolean isVerify() {
        return verify;
    }

    @Override
    public String toString() {
        return "CompilerConfig{bitWidth=" + bitWidth + ", verify=" + verify + "}";
    }

    /**
     * A builder for a {@link CompilerConfig}.
     */
    public static class Builder {
        private int bitWidth = DEFAULT_BIT_WIDTH;
        private boolean verify = true;

        /**
         * Set the register width. By default, {@value #DEFAULT_BIT_WIDTH}.
         *
         * @param bitWidth The width, from 1 to {@value #MAX_BIT_WIDTH}.
         * @return This builder, for convenience.
         * @throws IllegalArgumentException If the width is out of range.
         */
        public Builder setBitWidth(int bitWidth) {
            if (bitWidth < 1 || bitWidth > MAX_BIT_WIDTH) {
                throw new IllegalArgumentException("bit width must be in [1, " + MAX_BIT_WIDTH + "]: " + bitWidth);
            }
            this.bitWidth = bitWidth;
            return this;
        }

        /**
         * Set whether to verify enforced code. By default, true.
         *
         * @param verify Whether to verify.
         * @return This builder, for convenience.
         */
        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}
