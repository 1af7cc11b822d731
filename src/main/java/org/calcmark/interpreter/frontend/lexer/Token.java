package org.calcmark.interpreter.frontend.lexer;

/**
 * Represents a single token produced by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param value The literal text of the token, or {@code null} for {@link TokenType#END_OF_FILE}.
 *              Identifiers carry their normalized name, numbers their raw digit text.
 * @param offset The zero-based position in the source where the token starts.
 */
public record Token(
        TokenType type,
        String value,
        int offset
) {
}
