package org.foldcalc.cli.session;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Objects;

/**
 * A {@link LineSource} over any {@link BufferedReader}, used for files and piped input.
 */
public class ReaderLineSource implements LineSource {

    private final BufferedReader reader;

    public ReaderLineSource(BufferedReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public String readLine() throws IOException {
        return reader.readLine();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
