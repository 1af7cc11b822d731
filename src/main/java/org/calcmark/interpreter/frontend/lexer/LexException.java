package org.calcmark.interpreter.frontend.lexer;

import org.calcmark.interpreter.diagnostics.InterpreterException;

/**
 * Thrown when the {@link Lexer} meets a character that cannot start any token.
 */
public class LexException extends InterpreterException {

    private final char character;
    private final int offset;

    /**
     * Constructs a new lex exception.
     * @param character The unexpected character.
     * @param offset The position of the character in the source.
     */
    public LexException(char character, int offset) {
        super(String.format("Unexpected character '%s' at %d", character, offset));
        this.character = character;
        this.offset = offset;
    }

    public char getCharacter() {
        return character;
    }

    public int getOffset() {
        return offset;
    }
}
