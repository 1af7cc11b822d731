package org.calcmark.interpreter.frontend.parser;

import org.calcmark.interpreter.diagnostics.InterpreterException;
import org.calcmark.interpreter.frontend.lexer.Token;
import org.calcmark.interpreter.frontend.lexer.TokenType;

/**
 * Thrown when the current token does not match what the grammar expects.
 */
public class SyntaxException extends InterpreterException {

    private final TokenType expected;
    private final Token actual;

    /**
     * Constructs a new syntax exception.
     * @param expected The token type the parser required.
     * @param actual The token that was found instead.
     */
    public SyntaxException(TokenType expected, Token actual) {
        super(String.format("Invalid syntax: expected %s but got %s at %d.", expected, actual.type(), actual.offset()));
        this.expected = expected;
        this.actual = actual;
    }

    public TokenType getExpected() {
        return expected;
    }

    public Token getActual() {
        return actual;
    }
}
