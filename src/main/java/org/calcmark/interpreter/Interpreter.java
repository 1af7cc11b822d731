package org.calcmark.interpreter;

import org.calcmark.interpreter.api.IInterpreter;
import org.calcmark.interpreter.api.InterpretationException;
import org.calcmark.interpreter.api.InterpretationResult;
import org.calcmark.interpreter.backend.EvaluatorVisitor;
import org.calcmark.interpreter.backend.PrinterVisitor;
import org.calcmark.interpreter.diagnostics.InterpreterException;
import org.calcmark.interpreter.frontend.parser.Parser;
import org.calcmark.interpreter.frontend.parser.ast.AstNode;
import org.calcmark.interpreter.frontend.parser.ast.AstVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * The main interpreter implementation. It wires the lexer, the parser and a visitor
 * together for one program at a time. Instances hold no per-call state and can be reused.
 */
public class Interpreter implements IInterpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final String resultVariable;

    /**
     * Creates an interpreter that reads results from {@code out}.
     */
    public Interpreter() {
        this(EvaluatorVisitor.DEFAULT_RESULT_VARIABLE);
    }

    /**
     * Creates an interpreter with a custom result variable.
     * @param resultVariable The variable whose final value is the program result.
     */
    public Interpreter(String resultVariable) {
        this.resultVariable = resultVariable;
    }

    @Override
    public AstNode parse(String source) throws InterpretationException {
        try {
            AstNode root = new Parser(source).parse();
            LOG.debug("Parsed program of {} characters", source.length());
            return root;
        } catch (InterpreterException e) {
            throw new InterpretationException(e.getMessage(), e);
        }
    }

    @Override
    public <R> R interpret(String source, AstVisitor<R> visitor) throws InterpretationException {
        AstNode root = parse(source);
        try {
            return root.accept(visitor);
        } catch (InterpreterException e) {
            throw new InterpretationException(e.getMessage(), e);
        }
    }

    @Override
    public OptionalDouble evaluate(String source) throws InterpretationException {
        EvaluatorVisitor evaluator = new EvaluatorVisitor(resultVariable);
        interpret(source, evaluator);
        return evaluator.getOutput();
    }

    @Override
    public String print(String source) throws InterpretationException {
        return interpret(source, new PrinterVisitor());
    }

    @Override
    public InterpretationResult interpret(String source) throws InterpretationException {
        EvaluatorVisitor evaluator = new EvaluatorVisitor(resultVariable);
        interpret(source, evaluator);
        String rendering = print(source);
        if (evaluator.getOutput().isEmpty()) {
            LOG.debug("Program never assigned '{}'", resultVariable);
        }
        return new InterpretationResult(rendering, resultVariable, evaluator.getOutput(), evaluator.getSymbols());
    }
}
