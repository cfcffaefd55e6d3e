package org.foldcalc.cli.session;

import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.diagnostics.Diagnostic;
import org.foldcalc.calculator.eval.CalcValue;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Prints results to one writer and diagnostics to another.
 */
public class PrintWriterResultSink implements ResultSink {

    private final PrintWriter out;
    private final PrintWriter err;
    private final boolean showCaret;

    /**
     * @param out Writer for results.
     * @param err Writer for diagnostics; may be the same as {@code out}.
     * @param showCaret Whether diagnostics echo the line with a caret under the error.
     */
    public PrintWriterResultSink(PrintWriter out, PrintWriter err, boolean showCaret) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.showCaret = showCaret;
    }

    @Override
    public void accept(String line, CalcValue result) {
        out.println(result.render());
        out.flush();
    }

    @Override
    public void reject(String line, EvaluationException error) {
        err.println(Diagnostic.of(line, error).render(showCaret));
        err.flush();
    }
}
