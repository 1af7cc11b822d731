package org.calcmark.interpreter.frontend.semantics;

import org.calcmark.interpreter.diagnostics.InterpreterException;

/**
 * Thrown when an identifier is referenced that is neither a built-in constant nor an
 * assigned variable.
 */
public class UndefinedSymbolException extends InterpreterException {

    private final String symbol;

    /**
     * Constructs a new undefined symbol exception.
     * @param symbol The name that could not be resolved.
     */
    public UndefinedSymbolException(String symbol) {
        super("Undefined symbol '" + symbol + "'.");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
