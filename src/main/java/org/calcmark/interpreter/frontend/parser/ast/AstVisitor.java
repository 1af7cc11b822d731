package org.calcmark.interpreter.frontend.parser.ast;

/**
 * A traversal strategy applied to the AST, one method per node type.
 *
 * @param <R> The result type produced for each visited node.
 */
public interface AstVisitor<R> {
    R visitValueExpr(ValueExpr expr);

    R visitRefExpr(RefExpr expr);

    R visitUnaryExpr(UnaryExpr expr);

    R visitFactorialExpr(FactorialExpr expr);

    R visitBinaryExpr(BinaryExpr expr);

    R visitAssignExpr(AssignExpr expr);

    R visitStatementListExpr(StatementListExpr expr);
}
