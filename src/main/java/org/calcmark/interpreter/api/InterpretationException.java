package org.calcmark.interpreter.api;

/**
 * An exception that is thrown when a program cannot be lexed, parsed or evaluated.
 * <p>
 * It is part of the public API and hides the internal exception types of the interpreter,
 * which remain available as the cause.
 */
public class InterpretationException extends Exception {

    /**
     * Constructs a new interpretation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public InterpretationException(String message, Throwable cause) {
        super(message, cause);
    }
}
