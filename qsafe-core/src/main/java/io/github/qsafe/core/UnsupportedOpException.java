package io.github.qsafe.core;

/**
 * Thrown when an operation reaches a pass or the circuit backend that has no lowering for it.
 */
public class UnsupportedOpException extends CompileException {
    public UnsupportedOpException(String message) {
        super(message);
    }
}
