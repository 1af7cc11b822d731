package org.calcmark.interpreter.frontend.parser.ast;

/**
 * An AST node that represents a numeric literal.
 *
 * @param num The raw literal text. It is converted to a number only during evaluation.
 */
public record ValueExpr(String num) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitValueExpr(this);
    }
}
