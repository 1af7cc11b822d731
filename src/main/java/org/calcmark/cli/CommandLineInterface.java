package org.calcmark.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.calcmark.cli.config.CalculatorOptions;
import org.calcmark.cli.config.ConfigLoader;
import org.calcmark.cli.config.LoggingConfigurator;
import org.calcmark.interpreter.Interpreter;
import org.calcmark.interpreter.api.InterpretationException;
import org.calcmark.interpreter.api.InterpretationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "calcmark",
    mixinStandardHelpOptions = true,
    version = "CalcMark 1.0",
    description = "Evaluates arithmetic programs and renders them as HTML markup."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(names = {"-e", "--expression"}, description = "Program text to run, e.g. \"x = 2; out = x ^ 3\"")
    private String expression;

    @Parameters(index = "0", arity = "0..1", description = "File containing the program to run")
    private File programFile;

    @Option(names = "--eval-only", description = "Print only the result line")
    private boolean evalOnly;

    @Option(names = "--print-only", description = "Print only the rendered markup; the program is not evaluated")
    private boolean printOnly;

    @Option(names = "--symbols", description = "Also print every binding after evaluation (not with --print-only)")
    private boolean showSymbols;

    @Override
    public Integer call() throws IOException {
        if (evalOnly && printOnly) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--eval-only and --print-only are mutually exclusive");
        }
        if (printOnly && showSymbols) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--symbols needs evaluation and cannot be combined with --print-only");
        }
        if (expression != null && programFile != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Give either --expression or a program file, not both");
        }

        final Config config;
        final CalculatorOptions options;
        try {
            config = ConfigLoader.load(configFile);
            options = CalculatorOptions.from(config);
        } catch (ConfigException | IllegalArgumentException e) {
            error("Failed to load configuration: " + e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);

        Interpreter interpreter = new Interpreter(options.resultVariable());

        if (expression == null && programFile == null) {
            new ReplSession(interpreter).run();
            return 0;
        }

        final String source;
        if (expression != null) {
            source = expression;
        } else {
            try {
                source = Files.readString(programFile.toPath(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                error("Cannot read program file: " + programFile);
                LOG.debug("Reading {} failed", programFile, e);
                return 1;
            }
        }

        return run(interpreter, source, spec.commandLine().getOut());
    }

    private int run(Interpreter interpreter, String source, PrintWriter out) {
        try {
            if (printOnly) {
                out.println(interpreter.print(source));
                return 0;
            }

            InterpretationResult result = interpreter.interpret(source);
            out.println(evalOnly ? result.resultLine() : result.render());
            if (showSymbols) {
                for (Map.Entry<String, Double> entry : result.symbols().entrySet()) {
                    out.println(entry.getKey() + " = " + InterpretationResult.formatNumber(entry.getValue()));
                }
            }
            return 0;
        } catch (InterpretationException e) {
            LOG.debug("Interpretation failed", e);
            error(e.getMessage());
            return 1;
        } finally {
            out.flush();
        }
    }

    private void error(String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println(message);
        err.flush();
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
