package org.calcmark.cli;

import org.calcmark.interpreter.api.IInterpreter;
import org.calcmark.interpreter.api.InterpretationException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * An interactive read-eval-print loop. Every line is an independent program: variables
 * assigned on one line are not visible on the next.
 */
public class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);
    private static final String PROMPT = "calcmark> ";

    private final IInterpreter interpreter;

    /**
     * Creates a new session.
     * @param interpreter The interpreter that runs each line.
     */
    public ReplSession(IInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * Reads lines from the system terminal until {@code exit}, {@code quit}, Ctrl+C or
     * end of input.
     * @throws IOException if the terminal cannot be opened.
     */
    public void run() throws IOException {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            PrintWriter out = terminal.writer();

            while (true) {
                String line;
                try {
                    line = lineReader.readLine(PROMPT);
                } catch (UserInterruptException | EndOfFileException e) {
                    break;
                }
                if (line == null) {
                    break;
                }

                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (isExitCommand(trimmed)) {
                    break;
                }
                out.println(handle(trimmed));
                out.flush();
            }
        }
        LOG.debug("REPL session ended.");
    }

    /**
     * Runs one line and formats the outcome for display.
     * @param line The program text.
     * @return The rendered result, or the error message prefixed with {@code Error: }.
     */
    String handle(String line) {
        try {
            return interpreter.interpret(line).render();
        } catch (InterpretationException e) {
            LOG.debug("Line failed: {}", e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    static boolean isExitCommand(String line) {
        return line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit");
    }
}
