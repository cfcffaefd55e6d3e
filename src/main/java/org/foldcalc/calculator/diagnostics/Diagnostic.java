package org.foldcalc.calculator.diagnostics;

import org.foldcalc.calculator.api.EvaluationErrorCode;
import org.foldcalc.calculator.api.EvaluationException;

/**
 * Represents a single error message for one evaluated line, ready to be shown to the user.
 *
 * @param code The error code.
 * @param message The error message, without position information.
 * @param line The line that was evaluated.
 * @param column The 1-based column the error refers to.
 */
public record Diagnostic(
        EvaluationErrorCode code,
        String message,
        String line,
        int column
) {

    /**
     * Creates a diagnostic from a failed evaluation.
     * @param line The line that was evaluated.
     * @param error The error it failed with.
     * @return The diagnostic.
     */
    public static Diagnostic of(String line, EvaluationException error) {
        return new Diagnostic(error.getErrorCode(), error.getMessage(), line, error.getColumn());
    }

    /**
     * Formats the diagnostic for display.
     * @param withCaret If {@code true}, the line is echoed with a caret under the offending column.
     * @return One line, or three lines separated by {@code \n} when a caret is requested.
     */
    public String render(boolean withCaret) {
        if (!withCaret) {
            return toString();
        }
        // Tabs are kept so the caret lines up on terminals that expand them.
        StringBuilder caret = new StringBuilder();
        for (int i = 0; i < column - 1; i++) {
            caret.append(i < line.length() && line.charAt(i) == '\t' ? '\t' : ' ');
        }
        caret.append('^');
        return line + "\n" + caret + "\n" + this;
    }

    @Override
    public String toString() {
        return String.format("[%s] column %d: %s", code, column, message);
    }
}
