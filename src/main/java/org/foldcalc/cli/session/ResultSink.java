package org.foldcalc.cli.session;

import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.eval.CalcValue;

/**
 * Receives the outcome of each evaluated line.
 */
public interface ResultSink {

    /**
     * Called when a line evaluated successfully.
     * @param line The evaluated line.
     * @param result Its value.
     */
    void accept(String line, CalcValue result);

    /**
     * Called when the evaluation of a line failed.
     * @param line The evaluated line.
     * @param error The error. No result exists for this line.
     */
    void reject(String line, EvaluationException error);
}
