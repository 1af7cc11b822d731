package org.calcmark.interpreter.frontend.parser.ast;

/**
 * An AST node for the factorial of an operand.
 *
 * @param operand The operand.
 */
public record FactorialExpr(AstNode operand) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFactorialExpr(this);
    }
}
