package org.calcmark.interpreter.backend;

import org.calcmark.interpreter.frontend.lexer.TokenType;
import org.calcmark.interpreter.frontend.parser.ast.AssignExpr;
import org.calcmark.interpreter.frontend.parser.ast.AstVisitor;
import org.calcmark.interpreter.frontend.parser.ast.BinaryExpr;
import org.calcmark.interpreter.frontend.parser.ast.FactorialExpr;
import org.calcmark.interpreter.frontend.parser.ast.RefExpr;
import org.calcmark.interpreter.frontend.parser.ast.StatementListExpr;
import org.calcmark.interpreter.frontend.parser.ast.UnaryExpr;
import org.calcmark.interpreter.frontend.parser.ast.ValueExpr;
import org.calcmark.interpreter.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Evaluates a program to numbers. Each instance owns its own {@link SymbolTable}, so a
 * fresh evaluator always starts with only the built-in constants defined.
 * <p>
 * The result of a program is the value bound to the result variable ({@code out} unless
 * configured otherwise) once all statements have run. It is not thread-safe.
 */
public class EvaluatorVisitor implements AstVisitor<Double> {

    /** The default name of the variable holding a program's result. */
    public static final String DEFAULT_RESULT_VARIABLE = "out";

    private static final Logger LOG = LoggerFactory.getLogger(EvaluatorVisitor.class);

    private final SymbolTable symbols = new SymbolTable();
    private final String resultVariable;

    /**
     * Creates an evaluator that reads its result from {@code out}.
     */
    public EvaluatorVisitor() {
        this(DEFAULT_RESULT_VARIABLE);
    }

    /**
     * Creates an evaluator with a custom result variable.
     * @param resultVariable The variable whose final value is the program result.
     */
    public EvaluatorVisitor(String resultVariable) {
        this.resultVariable = resultVariable;
    }

    /**
     * Returns the program result.
     * @return The value of the result variable, or empty if the program never assigned it.
     */
    public OptionalDouble getOutput() {
        return symbols.lookup(resultVariable);
    }

    /**
     * Returns all bindings after evaluation, including the built-in constants.
     * @return An unmodifiable snapshot of the symbol table.
     */
    public Map<String, Double> getSymbols() {
        return symbols.snapshot();
    }

    public String getResultVariable() {
        return resultVariable;
    }

    @Override
    public Double visitValueExpr(ValueExpr expr) {
        try {
            return Double.parseDouble(expr.num());
        } catch (NumberFormatException e) {
            // Malformed literals such as "1.2.3" are a numeric edge case, not an error.
            LOG.debug("Literal '{}' is not a decimal number, evaluating to NaN", expr.num());
            return Double.NaN;
        }
    }

    @Override
    public Double visitRefExpr(RefExpr expr) {
        return symbols.resolve(expr.name());
    }

    @Override
    public Double visitUnaryExpr(UnaryExpr expr) {
        double operand = expr.operand().accept(this);
        return expr.op() == TokenType.MINUS ? -operand : operand;
    }

    @Override
    public Double visitFactorialExpr(FactorialExpr expr) {
        return factorial(expr.operand().accept(this));
    }

    @Override
    public Double visitBinaryExpr(BinaryExpr expr) {
        double left = expr.left().accept(this);
        double right = expr.right().accept(this);
        switch (expr.op()) {
            case PLUS: return left + right;
            case MINUS: return left - right;
            case MULT: return left * right;
            case DIVI: return left / right;
            case POW: return Math.pow(left, right);
            default:
                throw new IllegalStateException("Unexpected token type '" + expr.op() + "' in binary operation!");
        }
    }

    @Override
    public Double visitAssignExpr(AssignExpr expr) {
        double value = expr.value().accept(this);
        symbols.define(expr.name(), value);
        LOG.trace("Assigned {} = {}", expr.name(), value);
        return value;
    }

    /**
     * Runs the statements in order.
     * @return The value of the last statement, or {@code null} for an empty program.
     */
    @Override
    public Double visitStatementListExpr(StatementListExpr expr) {
        Double last = null;
        for (AssignExpr statement : expr.statements()) {
            last = statement.accept(this);
        }
        return last;
    }

    /**
     * Multiplies 2, 3, ... while the counter does not exceed {@code n}. This is not the
     * gamma function: negative and NaN operands give 1, and 3.5 gives 3! = 6.
     */
    static double factorial(double n) {
        double result = 1;
        for (int i = 2; i <= n; i++) {
            result *= i;
            if (Double.isInfinite(result)) {
                break;
            }
        }
        return result;
    }
}
