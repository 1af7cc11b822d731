package org.calcmark.interpreter.frontend.parser;

import org.calcmark.interpreter.frontend.lexer.Lexer;
import org.calcmark.interpreter.frontend.lexer.Token;
import org.calcmark.interpreter.frontend.lexer.TokenType;
import org.calcmark.interpreter.frontend.parser.ast.AssignExpr;
import org.calcmark.interpreter.frontend.parser.ast.AstNode;
import org.calcmark.interpreter.frontend.parser.ast.BinaryExpr;
import org.calcmark.interpreter.frontend.parser.ast.FactorialExpr;
import org.calcmark.interpreter.frontend.parser.ast.RefExpr;
import org.calcmark.interpreter.frontend.parser.ast.StatementListExpr;
import org.calcmark.interpreter.frontend.parser.ast.UnaryExpr;
import org.calcmark.interpreter.frontend.parser.ast.ValueExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive-descent parser with a single token of lookahead. It pulls tokens from a
 * {@link Lexer} on demand and produces one {@link StatementListExpr} per program.
 * <p>
 * Grammar:
 * <pre>
 * program    := ( assignment (EOL | SEMICOLON)? )* EOF
 * assignment := IDENTIFIER '=' expr
 * expr       := term ( (PLUS | MINUS) expr )?
 * term       := factor ( NUMBER-implicit-mult | (MULT | DIVI | POW) term )?
 * factor     := (PLUS | MINUS) factor | FACTORIAL factor | primary FACTORIAL*
 * primary    := '(' expr ')' | IDENTIFIER | NUMBER
 * </pre>
 * Because {@code expr} and {@code term} recurse into themselves on the right, every binary
 * operator is right-associative: {@code 1 - 2 - 3} is {@code 1 - (2 - 3)}.
 * <p>
 * The first error aborts the parse; there is no recovery.
 */
public class Parser {

    private final Lexer lexer;
    private Token current;

    /**
     * Constructs a new Parser and reads the first token.
     * @param source The program text.
     * @throws org.calcmark.interpreter.frontend.lexer.LexException if the first token is malformed.
     */
    public Parser(String source) {
        this.lexer = new Lexer(source);
        this.current = lexer.nextToken();
    }

    /**
     * Parses the whole program.
     * @return The root of the AST.
     * @throws SyntaxException if the token stream does not match the grammar.
     */
    public StatementListExpr parse() {
        List<AssignExpr> statements = new ArrayList<>();
        while (!check(TokenType.END_OF_FILE)) {
            statements.add(assignment());
            // At most one separator per statement; a blank line is not skipped.
            if (check(TokenType.END_OF_LINE) || check(TokenType.SEMICOLON)) {
                advance();
            }
        }
        return new StatementListExpr(statements);
    }

    private AssignExpr assignment() {
        Token id = consume(TokenType.IDENTIFIER);
        consume(TokenType.ASSIGN);
        return new AssignExpr(id, expr());
    }

    private AstNode expr() {
        AstNode term = term();
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType op = advance().type();
            return new BinaryExpr(term, op, expr());
        }
        return term;
    }

    private AstNode term() {
        AstNode factor = factor();

        // Implicit multiplication, only between two adjacent numbers ("2 3").
        if (check(TokenType.NUMBER)) {
            return new BinaryExpr(factor, TokenType.MULT, term());
        }

        if (check(TokenType.MULT) || check(TokenType.DIVI) || check(TokenType.POW)) {
            TokenType op = advance().type();
            return new BinaryExpr(factor, op, term());
        }
        return factor;
    }

    private AstNode factor() {
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType op = advance().type();
            return new UnaryExpr(op, factor());
        }

        if (check(TokenType.FACTORIAL)) {
            advance();
            return new FactorialExpr(factor());
        }

        AstNode primary = primary();
        while (check(TokenType.FACTORIAL)) {
            advance();
            primary = new FactorialExpr(primary);
        }
        return primary;
    }

    private AstNode primary() {
        if (check(TokenType.LEFT_PAREN)) {
            advance();
            AstNode expr = expr();
            consume(TokenType.RIGHT_PAREN);
            return expr;
        }

        if (check(TokenType.IDENTIFIER)) {
            return new RefExpr(advance());
        }

        return new ValueExpr(consume(TokenType.NUMBER).value());
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private Token advance() {
        Token previous = current;
        current = lexer.nextToken();
        return previous;
    }

    private Token consume(TokenType type) {
        if (check(type)) return advance();
        throw new SyntaxException(type, current);
    }
}
