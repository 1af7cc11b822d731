package org.calcmark.interpreter;

import org.calcmark.interpreter.api.InterpretationException;
import org.calcmark.interpreter.api.InterpretationResult;
import org.calcmark.interpreter.backend.EvaluatorVisitor;
import org.calcmark.interpreter.frontend.lexer.LexException;
import org.calcmark.interpreter.frontend.parser.SyntaxException;
import org.calcmark.interpreter.frontend.parser.ast.StatementListExpr;
import org.calcmark.interpreter.frontend.semantics.UndefinedSymbolException;
import org.calcmark.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Interpreter} entry point: running visitors over fresh
 * parses, combining printer and evaluator output, and hiding internal exceptions behind
 * {@link InterpretationException}.
 */
@ExtendWith(LogWatchExtension.class)
public class InterpreterTest {

    private final Interpreter interpreter = new Interpreter();

    @Test
    @Tag("unit")
    void testParseReturnsStatementList() throws InterpretationException {
        assertThat(interpreter.parse("out = 1")).isInstanceOf(StatementListExpr.class);
    }

    @Test
    @Tag("unit")
    void testInterpretWithVisitorKeepsVisitorState() throws InterpretationException {
        // Arrange
        EvaluatorVisitor evaluator = new EvaluatorVisitor();

        // Act
        Double last = interpreter.interpret("x = 4; out = x ^ 0.5", evaluator);

        // Assert
        assertThat(last).isEqualTo(2.0);
        assertThat(evaluator.getOutput()).hasValue(2.0);
        assertThat(evaluator.getSymbols()).containsEntry("x", 4.0);
    }

    @Test
    @Tag("unit")
    void testEvaluateAndPrint() throws InterpretationException {
        assertThat(interpreter.evaluate("out = 2 + 3")).hasValue(5.0);
        assertThat(interpreter.print("out = 2 + 3")).isEqualTo("out = 2 &plus; 3<br>");
    }

    @Test
    @Tag("unit")
    void testInterpretCombinesBothRuns() throws InterpretationException {
        // Act
        InterpretationResult result = interpreter.interpret("x = 2; y = x * 3; out = y + 1");

        // Assert
        assertThat(result.rendering()).isEqualTo("x = 2<br>y = x &times; 3<br>out = y &plus; 1<br>");
        assertThat(result.output()).hasValue(7.0);
        assertThat(result.symbols()).containsEntry("x", 2.0).containsEntry("y", 6.0);
        assertThat(result.render()).isEqualTo("x = 2<br>y = x &times; 3<br>out = y &plus; 1<br> <br>out = 7");
    }

    @Test
    @Tag("unit")
    void testMissingOutRendersUndefined() throws InterpretationException {
        InterpretationResult result = interpreter.interpret("x = 1");

        assertThat(result.output()).isEmpty();
        assertThat(result.resultLine()).isEqualTo("out = undefined");
    }

    @Test
    @Tag("unit")
    void testEachCallStartsFresh() throws InterpretationException {
        interpreter.evaluate("x = 1; out = x");

        assertThatThrownBy(() -> interpreter.evaluate("out = x"))
                .isInstanceOf(InterpretationException.class)
                .hasCauseInstanceOf(UndefinedSymbolException.class)
                .hasMessage("Undefined symbol 'x'.");
    }

    @Test
    @Tag("unit")
    void testLexErrorIsWrapped() {
        assertThatThrownBy(() -> interpreter.evaluate("out = 1 % 2"))
                .isInstanceOf(InterpretationException.class)
                .hasCauseInstanceOf(LexException.class)
                .hasMessage("Unexpected character '%' at 8");
    }

    @Test
    @Tag("unit")
    void testSyntaxErrorIsWrapped() {
        assertThatThrownBy(() -> interpreter.print("out = 2pi"))
                .isInstanceOf(InterpretationException.class)
                .hasCauseInstanceOf(SyntaxException.class);
    }

    @Test
    @Tag("unit")
    void testPrinterIsLenientWhereEvaluatorFails() throws InterpretationException {
        assertThat(interpreter.print("out = z + 1")).isEqualTo("out = z &plus; 1<br>");
        assertThatThrownBy(() -> interpreter.interpret("out = z + 1"))
                .hasCauseInstanceOf(UndefinedSymbolException.class);
    }

    @Test
    @Tag("unit")
    void testCustomResultVariable() throws InterpretationException {
        Interpreter custom = new Interpreter("result");

        InterpretationResult result = custom.interpret("result = 6 / 4");

        assertThat(result.render()).isEqualTo("result = <sup>6</sup>&frasl;<sub>4</sub><br> <br>result = 1.5");
    }

    @Test
    @Tag("unit")
    void testNumberFormatting() {
        assertThat(InterpretationResult.formatNumber(7.0)).isEqualTo("7");
        assertThat(InterpretationResult.formatNumber(-2.0)).isEqualTo("-2");
        assertThat(InterpretationResult.formatNumber(0.5)).isEqualTo("0.5");
        assertThat(InterpretationResult.formatNumber(Math.PI)).isEqualTo("3.141592653589793");
        assertThat(InterpretationResult.formatNumber(Double.NaN)).isEqualTo("NaN");
        assertThat(InterpretationResult.formatNumber(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
    }
}
