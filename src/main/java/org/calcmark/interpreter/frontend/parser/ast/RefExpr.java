package org.calcmark.interpreter.frontend.parser.ast;

import org.calcmark.interpreter.frontend.lexer.Token;

/**
 * An AST node that references a named constant or variable.
 *
 * @param token The identifier token.
 */
public record RefExpr(Token token) implements AstNode {

    /**
     * Gets the referenced name.
     * @return The identifier text.
     */
    public String name() {
        return token.value();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRefExpr(this);
    }
}
