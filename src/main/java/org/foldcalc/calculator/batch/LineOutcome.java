package org.foldcalc.calculator.batch;

import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.eval.CalcValue;

/**
 * The result of evaluating one line of a batch.
 */
public sealed interface LineOutcome permits LineOutcome.Success, LineOutcome.Failure {

    /**
     * @return The 1-based number of the line in the input.
     */
    int lineNumber();

    /**
     * @return The evaluated line.
     */
    String line();

    /**
     * @param lineNumber The 1-based line number.
     * @param line The evaluated line.
     * @param value Its value.
     */
    record Success(int lineNumber, String line, CalcValue value) implements LineOutcome {}

    /**
     * @param lineNumber The 1-based line number.
     * @param line The evaluated line.
     * @param error The error the evaluation failed with.
     */
    record Failure(int lineNumber, String line, EvaluationException error) implements LineOutcome {}
}
