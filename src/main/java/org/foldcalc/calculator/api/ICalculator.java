package org.foldcalc.calculator.api;

import org.foldcalc.calculator.eval.CalcValue;

/**
 * Defines the public interface for evaluating one expression line.
 */
public interface ICalculator {

    /**
     * Tokenizes and evaluates a single line, strictly left to right.
     *
     * @param line A non-blank expression such as {@code "2 + 3 * 4"}.
     * @return The value of the expression.
     * @throws EvaluationException if the line contains an invalid character, is malformed,
     *                             or divides by zero.
     * @throws IllegalArgumentException if the line is blank.
     */
    CalcValue evaluate(String line) throws EvaluationException;
}
