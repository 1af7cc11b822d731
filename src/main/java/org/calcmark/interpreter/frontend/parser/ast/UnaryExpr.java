package org.calcmark.interpreter.frontend.parser.ast;

import org.calcmark.interpreter.frontend.lexer.TokenType;

/**
 * An AST node for a sign applied to an operand.
 *
 * @param op Either {@link TokenType#PLUS} or {@link TokenType#MINUS}.
 * @param operand The signed operand.
 */
public record UnaryExpr(TokenType op, AstNode operand) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryExpr(this);
    }
}
