package io.github.qsafe.core;

/**
 * Thrown when an instruction references a value that was never defined.
 */
public class UndefinedValueException extends CompileException {
    public UndefinedValueException(String message) {
        super(message);
    }
}
