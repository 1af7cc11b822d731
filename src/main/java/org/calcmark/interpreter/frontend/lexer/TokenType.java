package org.calcmark.interpreter.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A variable or constant name, e.g. {@code x} or {@code pi}. */
    IDENTIFIER,
    /** A run of digits and dots, e.g. {@code 3.14}. */
    NUMBER,
    /** The '=' character. */
    ASSIGN,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The ',' character. */
    COMMA,
    /** The ';' character, a statement separator. */
    SEMICOLON,
    /** The '+' character. */
    PLUS,
    /** The '-' character. */
    MINUS,
    /** The '*' character. */
    MULT,
    /** The '/' character. */
    DIVI,
    /** The '^' character. */
    POW,
    /** The '!' character. */
    FACTORIAL,
    /** A newline, a statement separator. */
    END_OF_LINE,
    /** The end of the source. */
    END_OF_FILE
}
