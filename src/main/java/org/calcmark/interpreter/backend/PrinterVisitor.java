package org.calcmark.interpreter.backend;

import org.calcmark.interpreter.frontend.lexer.TokenType;
import org.calcmark.interpreter.frontend.parser.ast.AssignExpr;
import org.calcmark.interpreter.frontend.parser.ast.AstNode;
import org.calcmark.interpreter.frontend.parser.ast.AstVisitor;
import org.calcmark.interpreter.frontend.parser.ast.BinaryExpr;
import org.calcmark.interpreter.frontend.parser.ast.FactorialExpr;
import org.calcmark.interpreter.frontend.parser.ast.RefExpr;
import org.calcmark.interpreter.frontend.parser.ast.StatementListExpr;
import org.calcmark.interpreter.frontend.parser.ast.UnaryExpr;
import org.calcmark.interpreter.frontend.parser.ast.ValueExpr;

import java.util.Map;

/**
 * Renders a program as HTML markup: constants become entities, division a
 * superscript/subscript fraction and exponentiation a superscript.
 * <p>
 * Parentheses are decided per node by looking at the direct child and, for binary
 * children, at the child's operator relative to the parent's. There is no global
 * precedence table.
 * <p>
 * Unknown identifiers are printed as written; unlike evaluation, printing never fails on
 * an unresolved name.
 */
public class PrinterVisitor implements AstVisitor<String> {

    private static final Map<String, String> CONSTANTS = Map.of(
            "pi", "&pi;",
            "e", "<i>e</i>"
    );

    /**
     * Renders a tree.
     * @param node The root node.
     * @return The markup.
     */
    public String print(AstNode node) {
        return node.accept(this);
    }

    @Override
    public String visitValueExpr(ValueExpr expr) {
        return expr.num();
    }

    @Override
    public String visitRefExpr(RefExpr expr) {
        return CONSTANTS.getOrDefault(expr.name(), expr.name());
    }

    @Override
    public String visitUnaryExpr(UnaryExpr expr) {
        String sign = expr.op() == TokenType.MINUS ? "&minus;" : "";
        return sign + operand(expr.operand());
    }

    @Override
    public String visitFactorialExpr(FactorialExpr expr) {
        return "!" + operand(expr.operand());
    }

    @Override
    public String visitBinaryExpr(BinaryExpr expr) {
        String left = expr.left().accept(this);
        if (!isBareLeft(expr.left(), expr.op())) {
            left = "(" + left + ")";
        }

        String right = expr.right().accept(this);
        if (!isBareRight(expr.right(), expr.op())) {
            right = "(" + right + ")";
        }

        return layout(expr.op(), left, right);
    }

    @Override
    public String visitAssignExpr(AssignExpr expr) {
        return expr.name() + " = " + expr.value().accept(this);
    }

    @Override
    public String visitStatementListExpr(StatementListExpr expr) {
        StringBuilder builder = new StringBuilder();
        for (AssignExpr statement : expr.statements()) {
            builder.append(statement.accept(this)).append("<br>");
        }
        return builder.toString();
    }

    private String operand(AstNode operand) {
        String rendered = operand.accept(this);
        if (isAtom(operand)) {
            return rendered;
        }
        return "(" + rendered + ")";
    }

    private static boolean isAtom(AstNode node) {
        return node instanceof ValueExpr || node instanceof RefExpr || node instanceof FactorialExpr;
    }

    private static boolean isBareLeft(AstNode left, TokenType parentOp) {
        if (isAtom(left)) {
            return true;
        }
        return left instanceof BinaryExpr binary
                && (binary.op() == TokenType.DIVI || binary.op() == TokenType.POW || binary.op() == parentOp);
    }

    private static boolean isBareRight(AstNode right, TokenType parentOp) {
        // A superscript exponent needs no parentheses.
        if (isAtom(right) || parentOp == TokenType.POW) {
            return true;
        }
        return right instanceof BinaryExpr binary
                && (binary.op() == TokenType.DIVI || binary.op() == TokenType.POW || binary.op() == parentOp);
    }

    private static String layout(TokenType op, String left, String right) {
        switch (op) {
            case PLUS: return left + " &plus; " + right;
            case MINUS: return left + " &minus; " + right;
            case MULT: return left + " &times; " + right;
            case DIVI: return "<sup>" + left + "</sup>&frasl;<sub>" + right + "</sub>";
            case POW: return left + "<sup>" + right + "</sup>";
            default:
                throw new IllegalStateException("Unexpected token type '" + op + "' in binary operation!");
        }
    }
}
