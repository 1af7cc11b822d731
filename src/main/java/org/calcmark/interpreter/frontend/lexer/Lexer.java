package org.calcmark.interpreter.frontend.lexer;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the program text into tokens.
 * <p>
 * Tokens are produced on demand, one per call to {@link #nextToken()}. Once the cursor has
 * moved past the end of the source, every further call returns an {@link TokenType#END_OF_FILE}
 * token.
 */
public class Lexer {

    private final String source;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The program text.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans the next token and advances the cursor past it.
     * @return The next token.
     * @throws LexException if the character at the cursor cannot start a token.
     */
    public Token nextToken() {
        skipWhitespace();
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_FILE, null, current);
        }

        int start = current;
        char c = peek();
        switch (c) {
            case '\n': return single(TokenType.END_OF_LINE, start);
            case ';': return single(TokenType.SEMICOLON, start);
            case '+': return single(TokenType.PLUS, start);
            case '-': return single(TokenType.MINUS, start);
            case '*': return single(TokenType.MULT, start);
            case '/': return single(TokenType.DIVI, start);
            case '^': return single(TokenType.POW, start);
            case '!': return single(TokenType.FACTORIAL, start);
            case '=': return single(TokenType.ASSIGN, start);
            case '(': return single(TokenType.LEFT_PAREN, start);
            case ')': return single(TokenType.RIGHT_PAREN, start);
            case ',': return single(TokenType.COMMA, start);
            default:
                if (isNumberChar(c)) {
                    return number(start);
                }
                if (isAlpha(c)) {
                    return identifier(start);
                }
                throw new LexException(c, start);
        }
    }

    /**
     * Returns the current cursor position.
     * @return The zero-based offset of the next unread character.
     */
    public int position() {
        return current;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            switch (peek()) {
                case '\t', '\u000B', ' ', '\f' -> current++;
                default -> {
                    return;
                }
            }
        }
    }

    private Token single(TokenType type, int start) {
        current++;
        return new Token(type, source.substring(start, current), start);
    }

    private Token number(int start) {
        // No validation here: "1.2.3" is a single NUMBER token.
        while (!isAtEnd() && isNumberChar(peek())) current++;
        return new Token(TokenType.NUMBER, source.substring(start, current), start);
    }

    private Token identifier(int start) {
        while (!isAtEnd() && (isAlpha(peek()) || isDigit(peek()))) current++;
        String text = source.substring(start, current);
        String lower = text.toLowerCase();
        if (lower.equals("e") || lower.equals("pi")) {
            return new Token(TokenType.IDENTIFIER, lower, start);
        }
        return new Token(TokenType.IDENTIFIER, text, start);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isNumberChar(char c) {
        return isDigit(c) || c == '.';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
