package io.github.qsafe.core;

/**
 * Thrown when compiling a function fails. Compilation of that function is abandoned;
 * nothing is retried or partially recovered.
 */
public abstract class CompileException extends RuntimeException {
    protected CompileException(String message) {
        super(message);
    }
}
