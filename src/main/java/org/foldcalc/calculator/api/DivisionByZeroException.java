package org.foldcalc.calculator.api;

/**
 * Thrown when the right-hand operand of a division is zero.
 */
public class DivisionByZeroException extends EvaluationException {

    /**
     * @param column The column of the zero operand.
     */
    public DivisionByZeroException(int column) {
        super(EvaluationErrorCode.DIVISION_BY_ZERO, column, "Division by zero");
    }
}
