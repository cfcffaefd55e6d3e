package org.foldcalc.calculator.api;

/**
 * Base class of all errors that abort the evaluation of a line.
 * <p>
 * It is part of the public API. An evaluation that throws produces no partial result;
 * the caller may continue with the next line.
 */
public abstract class EvaluationException extends Exception {

    private final EvaluationErrorCode errorCode;
    private final int column;

    /**
     * @param errorCode The code classifying the error.
     * @param column The 1-based column the error refers to.
     * @param message The detail message, without position information.
     */
    protected EvaluationException(EvaluationErrorCode errorCode, int column, String message) {
        super(message);
        this.errorCode = errorCode;
        this.column = column;
    }

    /**
     * @return The code classifying the error.
     */
    public EvaluationErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The 1-based column of the offending character or token.
     */
    public int getColumn() {
        return column;
    }
}
