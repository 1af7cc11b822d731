package org.calcmark.cli.config;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code calculator} configuration block.
 *
 * @param resultVariable The variable whose final value is shown as the program result.
 */
public record CalculatorOptions(String resultVariable) {

    private static final String RESULT_VARIABLE_PATH = "calculator.result-variable";

    /**
     * Reads the options from a loaded configuration.
     * @param config The configuration, with reference.conf as fallback.
     * @return The options.
     * @throws IllegalArgumentException if the result variable is blank.
     */
    public static CalculatorOptions from(Config config) {
        String resultVariable = config.getString(RESULT_VARIABLE_PATH);
        if (resultVariable.isBlank()) {
            throw new IllegalArgumentException("'" + RESULT_VARIABLE_PATH + "' must not be blank");
        }
        return new CalculatorOptions(resultVariable.trim());
    }
}
