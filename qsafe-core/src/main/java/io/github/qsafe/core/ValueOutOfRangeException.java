package io.github.qsafe.core;

/**
 * Thrown when a literal does not fit the configured two's complement width.
 */
public class ValueOutOfRangeException extends CompileException {
    public final long value;
    public final int width;

    public ValueOutOfRangeException(long value, int width) {
        super(String.format("Value %d is out of range for two's complement representation with %d bits: [%d, %d]",
                value, width, -(1L << (width - 1)), (1L << (width - 1)) - 1));
        this.value = value;
        this.width = width;
    }
}
