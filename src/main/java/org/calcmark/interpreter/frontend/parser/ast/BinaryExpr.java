package org.calcmark.interpreter.frontend.parser.ast;

import org.calcmark.interpreter.frontend.lexer.TokenType;

/**
 * An AST node for a binary arithmetic operation.
 *
 * @param left The left operand.
 * @param op One of {@link TokenType#PLUS}, {@link TokenType#MINUS}, {@link TokenType#MULT},
 *           {@link TokenType#DIVI} or {@link TokenType#POW}.
 * @param right The right operand.
 */
public record BinaryExpr(AstNode left, TokenType op, AstNode right) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryExpr(this);
    }
}
