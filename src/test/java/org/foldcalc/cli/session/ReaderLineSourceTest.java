package org.foldcalc.cli.session;

import org.foldcalc.calculator.Calculator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs a {@link CalculatorSession} over piped input, the way the interactive loop
 * reads when no terminal is attached.
 */
@Tag("unit")
class ReaderLineSourceTest {

    @Test
    void sessionOverReaderPrintsResultsAndDiagnostics() throws IOException {
        // Arrange
        BufferedReader reader = new BufferedReader(new StringReader("3 + 5\n\n3 @ 5\n2 + 3 * 4\n"));
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        PrintWriterResultSink sink = new PrintWriterResultSink(new PrintWriter(out), new PrintWriter(err), true);

        // Act
        SessionStatistics statistics;
        try (ReaderLineSource source = new ReaderLineSource(reader)) {
            statistics = new CalculatorSession(new Calculator(), source, sink).run();
        }

        // Assert
        assertThat(out.toString().lines()).containsExactly("8", "20");
        assertThat(err.toString().lines()).containsExactly(
                "3 @ 5",
                "  ^",
                "[UNEXPECTED_CHARACTER] column 3: Unexpected character '@'");
        assertThat(statistics).isEqualTo(new SessionStatistics(2, 1, 1));
        // A closed BufferedReader refuses further reads
        assertThatThrownBy(reader::ready).isInstanceOf(IOException.class);
    }

    @Test
    void returnsNullAtEndOfInput() throws IOException {
        try (ReaderLineSource source = new ReaderLineSource(new BufferedReader(new StringReader("1 + 1")))) {
            assertThat(source.readLine()).isEqualTo("1 + 1");
            assertThat(source.readLine()).isNull();
        }
    }
}
