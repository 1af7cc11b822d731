package org.calcmark.interpreter.api;

import org.calcmark.interpreter.frontend.parser.ast.AstNode;
import org.calcmark.interpreter.frontend.parser.ast.AstVisitor;

import java.util.OptionalDouble;

/**
 * Defines the public interface of the interpreter.
 * <p>
 * Every call parses the source afresh; no state is carried from one call to the next.
 */
public interface IInterpreter {

    /**
     * Parses a program.
     *
     * @param source The program text.
     * @return The root of the AST.
     * @throws InterpretationException if the program has a lexical or syntax error.
     */
    AstNode parse(String source) throws InterpretationException;

    /**
     * Parses a program and applies a visitor to it. The visitor keeps whatever state it
     * accumulated, so the caller can query it afterwards.
     *
     * @param source The program text.
     * @param visitor The visitor to apply.
     * @param <R> The visitor's result type.
     * @return The visitor's result for the root node.
     * @throws InterpretationException if parsing or visiting fails.
     */
    <R> R interpret(String source, AstVisitor<R> visitor) throws InterpretationException;

    /**
     * Evaluates a program with a fresh evaluator.
     *
     * @param source The program text.
     * @return The value of the result variable, or empty if the program never assigned it.
     * @throws InterpretationException if parsing or evaluation fails.
     */
    OptionalDouble evaluate(String source) throws InterpretationException;

    /**
     * Renders a program as markup.
     *
     * @param source The program text.
     * @return The markup.
     * @throws InterpretationException if parsing fails.
     */
    String print(String source) throws InterpretationException;

    /**
     * Renders and evaluates a program, parsing it once for each.
     *
     * @param source The program text.
     * @return Both outcomes.
     * @throws InterpretationException if parsing or evaluation fails.
     */
    InterpretationResult interpret(String source) throws InterpretationException;
}
