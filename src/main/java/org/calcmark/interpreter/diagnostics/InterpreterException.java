package org.calcmark.interpreter.diagnostics;

/**
 * Base type for every failure raised while lexing, parsing or evaluating a program.
 * <p>
 * All failures are terminal for the current call. The public API wraps them into a
 * {@link org.calcmark.interpreter.api.InterpretationException}.
 */
public class InterpreterException extends RuntimeException {

    /**
     * Constructs a new interpreter exception with the specified detail message.
     * @param message The detail message.
     */
    public InterpreterException(String message) {
        super(message);
    }
}
