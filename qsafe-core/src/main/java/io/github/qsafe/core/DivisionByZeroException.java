package io.github.qsafe.core;

/**
 * Thrown when an immediate divisor is zero. Raised at translation time, before any circuit is built.
 */
public class DivisionByZeroException extends CompileException {
    public DivisionByZeroException(String message) {
        super(message);
    }
}
