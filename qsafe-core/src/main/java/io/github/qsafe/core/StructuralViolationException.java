package io.github.qsafe.core;

/**
 * Thrown when quantum-safe IR breaks write-in-place, single-producer, no-cloning
 * or temporal validity. This always indicates a bug in a pass, never bad input.
 */
public class StructuralViolationException extends CompileException {
    public StructuralViolationException(String message) {
        super(message);
    }
}
