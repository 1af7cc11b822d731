package org.calcmark.interpreter.frontend.parser.ast;

import java.util.List;

/**
 * The root node of a program: assignments in source order.
 *
 * @param statements The statements, executed from first to last.
 */
public record StatementListExpr(List<AssignExpr> statements) implements AstNode {

    public StatementListExpr {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStatementListExpr(this);
    }
}
