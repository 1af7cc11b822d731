package org.calcmark.interpreter.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Maps identifiers to their current numeric value.
 * <p>
 * A new table holds only the built-in constants {@code pi} and {@code e}. Names are
 * case-sensitive; the lexer already normalizes the spelling of the constants.
 */
public class SymbolTable {

    /** Name of the built-in constant π. */
    public static final String PI = "pi";
    /** Name of the built-in constant e. */
    public static final String E = "e";

    private final Map<String, Double> values = new LinkedHashMap<>();

    /**
     * Constructs a table seeded with the built-in constants.
     */
    public SymbolTable() {
        values.put(PI, Math.PI);
        values.put(E, Math.E);
    }

    /**
     * Binds a value to a name, replacing any previous binding.
     * @param name The identifier.
     * @param value The value.
     */
    public void define(String name, double value) {
        values.put(name, value);
    }

    /**
     * Resolves a name.
     * @param name The identifier.
     * @return The bound value.
     * @throws UndefinedSymbolException if the name is not bound.
     */
    public double resolve(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new UndefinedSymbolException(name);
        }
        return value;
    }

    /**
     * Looks up a name without failing.
     * @param name The identifier.
     * @return The bound value, or empty if the name is not bound.
     */
    public OptionalDouble lookup(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Returns the current bindings in definition order.
     * @return An unmodifiable copy of the bindings.
     */
    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
