package org.foldcalc.cli.session;

import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.api.ICalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * The read-evaluate-print loop: reads lines until end of input, skips blank ones,
 * evaluates the rest and hands every outcome to the sink.
 * <p>
 * A failing line does not end the session; the next line is processed normally.
 */
public class CalculatorSession {

    private static final Logger log = LoggerFactory.getLogger(CalculatorSession.class);

    private final ICalculator calculator;
    private final LineSource source;
    private final ResultSink sink;

    public CalculatorSession(ICalculator calculator, LineSource source, ResultSink sink) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Runs the loop until the source reports end of input.
     * @return What happened to the lines read.
     * @throws IOException if reading from the source fails.
     */
    public SessionStatistics run() throws IOException {
        int evaluated = 0;
        int failed = 0;
        int skipped = 0;

        String line;
        while ((line = source.readLine()) != null) {
            if (line.isBlank()) {
                skipped++;
                continue;
            }
            try {
                sink.accept(line, calculator.evaluate(line));
                evaluated++;
            } catch (EvaluationException e) {
                sink.reject(line, e);
                failed++;
            }
        }

        SessionStatistics statistics = new SessionStatistics(evaluated, failed, skipped);
        log.debug("Session ended: {}", statistics);
        return statistics;
    }
}
