package org.foldcalc.cli.session;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * An interactive {@link LineSource} on a JLine terminal, with line editing and history.
 * Ctrl+D and Ctrl+C both end the input.
 */
public class TerminalLineSource implements LineSource {

    private final Terminal terminal;
    private final LineReader lineReader;
    private final String prompt;

    /**
     * Creates a line source on the given terminal.
     * @param terminal The terminal to read from. Closed together with this source.
     * @param prompt The prompt shown before each line.
     * @param historyFile File to persist the history in, or {@code null} for in-memory history.
     */
    public TerminalLineSource(Terminal terminal, String prompt, Path historyFile) {
        this.terminal = Objects.requireNonNull(terminal, "terminal");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        LineReaderBuilder builder = LineReaderBuilder.builder()
                .terminal(terminal)
                .history(new DefaultHistory());
        if (historyFile != null) {
            builder.variable(LineReader.HISTORY_FILE, historyFile);
        }
        this.lineReader = builder.build();
    }

    /**
     * Opens the system terminal.
     * @param prompt The prompt shown before each line.
     * @param historyFile File to persist the history in, or {@code null}.
     * @return The line source.
     * @throws IOException if the terminal cannot be opened.
     */
    public static TerminalLineSource openSystemTerminal(String prompt, Path historyFile) throws IOException {
        Terminal terminal = TerminalBuilder.builder().system(true).build();
        return new TerminalLineSource(terminal, prompt, historyFile);
    }

    @Override
    public String readLine() {
        try {
            return lineReader.readLine(prompt);
        } catch (UserInterruptException | EndOfFileException e) {
            return null;
        }
    }

    @Override
    public void close() throws IOException {
        try {
            lineReader.getHistory().save();
        } finally {
            terminal.close();
        }
    }
}
