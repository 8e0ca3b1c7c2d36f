package io.github.qsafe.core.util;

import io.github.qsafe.core.ValueOutOfRangeException;

/**
 * Two's complement encoding helpers. Bit 0 is the least significant bit, and a
 * negative {@code v} is stored as {@code 2^n + v}.
 */
public final class TwosComplement {
    private TwosComplement() {
    }

    public static long minValue(int width) {
        return -(1L << (width - 1));
    }

    public static long maxValue(int width) {
        return (1L << (width - 1)) - 1;
    }

    public static boolean fits(long value, int width) {
        return value >= minValue(width) && value <= maxValue(width);
    }

    /**
     * Check that {@code value} is representable in {@code width} bits.
     *
     * @param value The value.
     * @param width The width.
     * @return The value.
     * @throws ValueOutOfRangeException If it is not.
     */
    public static long checkRange(long value, int width) {
        if (!fits(value, width)) {
            throw new ValueOutOfRangeException(value, width);
        }
        return value;
    }

    /**
     * Reduce {@code value} modulo {@code 2^width}, and reinterpret it as signed.
     *
     * @param value The value.
     * @param width The width.
     * @return The wrapped value.
     */
    public static long wrap(long value, int width) {
        long unsigned = toUnsigned(value, width);
        return unsigned > maxValue(width) ? unsigned - (1L << width) : unsigned;
    }

    public static long toUnsigned(long value, int width) {
        return value & ((1L << width) - 1);
    }

    /**
     * Encode {@code value}, least significant bit first. The value is wrapped, not range checked.
     *
     * @param value The value.
     * @param width The width.
     * @return The bits.
     */
    public static boolean[] encode(long value, int width) {
        long unsigned = toUnsigned(value, width);
        boolean[] bits = new boolean[width];
        for (int i = 0; i < width; i++) {
            bits[i] = ((unsigned >> i) & 1) != 0;
        }
        return bits;
    }

    /**
     * Decode bits, least significant first, as a signed integer. The top bit is the sign at
     * every width, so a single set bit is -1.
     *
     * @param bits The bits.
     * @return The value.
     */
    public static long decode(boolean[] bits) {
        long unsigned = decodeUnsigned(bits);
        if (bits.length > 0 && bits[bits.length - 1]) {
            return unsigned - (1L << bits.length);
        }
        return unsigned;
    }

    public static long decodeUnsigned(boolean[] bits) {
        long unsigned = 0;
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) unsigned |= 1L << i;
        }
        return unsigned;
    }
}
