package org.foldcalc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.foldcalc.calculator.Calculator;
import org.foldcalc.cli.commands.BatchCommand;
import org.foldcalc.cli.commands.EvalCommand;
import org.foldcalc.cli.config.ConfigLoader;
import org.foldcalc.cli.config.LoggingConfigurator;
import org.foldcalc.cli.session.CalculatorSession;
import org.foldcalc.cli.session.LineSource;
import org.foldcalc.cli.session.PrintWriterResultSink;
import org.foldcalc.cli.session.ReaderLineSource;
import org.foldcalc.cli.session.SessionStatistics;
import org.foldcalc.cli.session.TerminalLineSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * The root command. Without a subcommand it starts the interactive calculator.
 */
@Command(
    name = "foldcalc",
    mixinStandardHelpOptions = true,
    version = "Foldcalc 1.0",
    description = "Evaluates arithmetic expressions strictly left to right.",
    subcommands = {
        EvalCommand.class,
        BatchCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-c", "--config"}, description = "Path to a HOCON configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " if present).")
    File configFile;

    @Option(names = "-D", mapFallbackValue = "", description = "Override a configuration value. For example: -Dfoldcalc.prompt=\">> \"")
    Map<String, String> configOverrides;

    @Spec
    CommandSpec spec;

    private final InputStream input;
    private final BooleanSupplier terminalAttached;
    private Config config;

    public CommandLineInterface() {
        this(System.in, () -> System.console() != null);
    }

    /**
     * @param input Where the interactive loop reads lines when no terminal is attached.
     * @param terminalAttached Whether to read from the JLine system terminal instead.
     */
    CommandLineInterface(final InputStream input, final BooleanSupplier terminalAttached) {
        this.input = input;
        this.terminalAttached = terminalAttached;
    }

    /**
     * Runs the interactive loop until end of input.
     * <p>
     * On a terminal, lines are read with JLine; when standard input is redirected,
     * lines are read plainly and no prompt is shown.
     *
     * @return 0 when the input ends.
     * @throws IOException if the terminal or standard input fails.
     */
    @Override
    public Integer call() throws IOException {
        final Config calculatorConfig = getConfig().getConfig("foldcalc");
        final PrintWriterResultSink sink = new PrintWriterResultSink(
                spec.commandLine().getOut(),
                spec.commandLine().getErr(),
                calculatorConfig.getBoolean("show-caret"));

        try (LineSource source = openLineSource(calculatorConfig)) {
            SessionStatistics statistics = new CalculatorSession(new Calculator(), source, sink).run();
            log.info("Interactive session finished: {}", statistics);
        }
        return 0;
    }

    private LineSource openLineSource(final Config calculatorConfig) throws IOException {
        if (!terminalAttached.getAsBoolean()) {
            log.debug("Standard input is not a terminal, reading lines without prompt.");
            return new ReaderLineSource(new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8)));
        }
        final Path historyFile = calculatorConfig.hasPath("history-file")
                ? Path.of(calculatorConfig.getString("history-file"))
                : null;
        return TerminalLineSource.openSystemTerminal(calculatorConfig.getString("prompt"), historyFile);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile, configOverrides);
            } catch (ConfigException | IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        System.exit(commandLine.execute(args));
    }
}
