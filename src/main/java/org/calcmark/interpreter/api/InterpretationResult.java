package org.calcmark.interpreter.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * The outcome of running both the printer and the evaluator over one program.
 *
 * @param rendering The markup produced by the printer.
 * @param resultVariable The name of the variable that holds the program result.
 * @param output The value of the result variable, or empty if the program never assigned it.
 * @param symbols All bindings after evaluation, including the built-in constants.
 */
public record InterpretationResult(
        String rendering,
        String resultVariable,
        OptionalDouble output,
        Map<String, Double> symbols
) {

    public InterpretationResult {
        symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    /**
     * Formats the result line, e.g. {@code out = 7}, or {@code out = undefined} when the
     * program never assigned the result variable.
     * @return The result line.
     */
    public String resultLine() {
        String value = output.isPresent() ? formatNumber(output.getAsDouble()) : "undefined";
        return resultVariable + " = " + value;
    }

    /**
     * Formats the display string: the rendering followed by the result line.
     * @return The display string.
     */
    public String render() {
        return rendering + " <br>" + resultLine();
    }

    /**
     * Formats a number the way the display shows it: integral values without a fraction
     * ({@code 7} rather than {@code 7.0}), everything else in its shortest decimal form.
     * @param value The value.
     * @return The formatted value.
     */
    public static String formatNumber(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
