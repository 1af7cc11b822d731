package org.calcmark.interpreter.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node types is closed. New interpretations of the tree are added by writing
 * another {@link AstVisitor}, never by touching the nodes.
 */
public sealed interface AstNode
        permits ValueExpr, RefExpr, UnaryExpr, FactorialExpr, BinaryExpr, AssignExpr, StatementListExpr {

    /**
     * Dispatches to the visitor method matching this node's type.
     *
     * @param visitor The visitor to apply.
     * @param <R> The visitor's result type.
     * @return The visitor's result for this node.
     */
    <R> R accept(AstVisitor<R> visitor);
}
