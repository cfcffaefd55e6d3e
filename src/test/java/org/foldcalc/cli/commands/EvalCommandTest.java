package org.foldcalc.cli.commands;

import org.foldcalc.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code eval} subcommand through picocli and checks its output and exit code.
 */
@Tag("integration")
class EvalCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void printsOneResultPerExpression() {
        int exitCode = commandLine.execute("eval", "3 + 5", "2 + 3 * 4", "8 / 2");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("8", "20", "4.0");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void reportsErrorsAndContinues() {
        int exitCode = commandLine.execute("eval", "3 @ 5", "1 + 1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().lines()).containsExactly("2");
        assertThat(err.toString().lines()).containsExactly(
                "3 @ 5",
                "  ^",
                "[UNEXPECTED_CHARACTER] column 3: Unexpected character '@'");
    }

    @Test
    void caretCanBeDisabledFromTheCommandLine() {
        int exitCode = commandLine.execute("-Dfoldcalc.show-caret=false", "eval", "10 / 0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString().lines()).containsExactly("[DIVISION_BY_ZERO] column 6: Division by zero");
    }

    @Test
    void blankArgumentsAreSkipped() {
        int exitCode = commandLine.execute("eval", "  ", "7 * 4");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("28");
    }

    @Test
    void requiresAtLeastOneExpression() {
        int exitCode = commandLine.execute("eval");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
