package org.foldcalc.calculator;

import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.api.ICalculator;
import org.foldcalc.calculator.eval.CalcValue;
import org.foldcalc.calculator.eval.Evaluator;
import org.foldcalc.calculator.lexer.Lexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The main calculator implementation. Each call builds its own {@link Lexer} and
 * {@link Evaluator}, so an instance holds no state and can be shared between threads.
 */
public class Calculator implements ICalculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    /**
     * {@inheritDoc}
     */
    @Override
    public CalcValue evaluate(String line) throws EvaluationException {
        Objects.requireNonNull(line, "line");
        if (line.isBlank()) {
            throw new IllegalArgumentException("Blank lines must be skipped before evaluation");
        }

        Evaluator evaluator = new Evaluator(new Lexer(line));
        try {
            CalcValue result = evaluator.evaluate();
            log.debug("Evaluated '{}' to {}", line, result.render());
            return result;
        } catch (EvaluationException e) {
            // Bad input is reported to the user by the caller, not logged as an error.
            log.debug("Evaluation of '{}' failed with {} at column {}: {}",
                    line, e.getErrorCode(), e.getColumn(), e.getMessage());
            throw e;
        }
    }
}
