package org.foldcalc.calculator.api;

/**
 * Defines unique, testable error codes for all errors that can occur while evaluating a line.
 * This decouples the test logic from the wording of the error messages.
 */
public enum EvaluationErrorCode {
    // region Lexer Errors
    /** A character that starts no valid token. */
    UNEXPECTED_CHARACTER,
    // endregion

    // region Syntax Errors
    /** An integer was required but something else was found. */
    EXPECTED_OPERAND,
    /** An operator or the end of the line was required but something else was found. */
    EXPECTED_OPERATOR,
    // endregion

    // region Arithmetic Errors
    /** The right-hand operand of a division was zero. */
    DIVISION_BY_ZERO
    // endregion
}
