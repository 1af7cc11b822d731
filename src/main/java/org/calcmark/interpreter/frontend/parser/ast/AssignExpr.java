package org.calcmark.interpreter.frontend.parser.ast;

import org.calcmark.interpreter.frontend.lexer.Token;

/**
 * An AST node that binds the value of an expression to a name.
 *
 * @param id The identifier token of the target.
 * @param value The assigned expression.
 */
public record AssignExpr(Token id, AstNode value) implements AstNode {

    /**
     * Gets the name of the assignment target.
     * @return The identifier text.
     */
    public String name() {
        return id.value();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignExpr(this);
    }
}
