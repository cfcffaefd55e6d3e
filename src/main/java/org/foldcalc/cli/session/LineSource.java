package org.foldcalc.cli.session;

import java.io.IOException;

/**
 * Supplies input lines one at a time.
 */
public interface LineSource extends AutoCloseable {

    /**
     * Reads the next line.
     * @return The line without its terminator, or {@code null} at end of input.
     * @throws IOException if the underlying input fails.
     */
    String readLine() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
