package org.foldcalc.calculator.api;

import org.foldcalc.calculator.lexer.Token;
import org.foldcalc.calculator.lexer.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when the token stream does not follow the operand, operator, operand, ... pattern.
 */
public class SyntaxException extends EvaluationException {

    private final Set<TokenType> expected;
    private final Token actual;

    /**
     * @param errorCode Either {@link EvaluationErrorCode#EXPECTED_OPERAND} or {@link EvaluationErrorCode#EXPECTED_OPERATOR}.
     * @param expected The token kinds that would have been accepted.
     * @param actual The token that was found instead.
     */
    public SyntaxException(EvaluationErrorCode errorCode, Set<TokenType> expected, Token actual) {
        super(errorCode, actual.column(), buildMessage(errorCode, expected, actual));
        this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.actual = actual;
    }

    /**
     * Creates the error for a position where an integer was required.
     * @param actual The token found instead.
     * @return The exception.
     */
    public static SyntaxException expectedOperand(Token actual) {
        return new SyntaxException(EvaluationErrorCode.EXPECTED_OPERAND, EnumSet.of(TokenType.INTEGER), actual);
    }

    /**
     * Creates the error for a position where an operator or the end of the line was required.
     * @param actual The token found instead.
     * @return The exception.
     */
    public static SyntaxException expectedOperator(Token actual) {
        return new SyntaxException(EvaluationErrorCode.EXPECTED_OPERATOR,
                EnumSet.of(TokenType.PLUS, TokenType.MINUS, TokenType.TIMES, TokenType.DIVIDE, TokenType.END_OF_INPUT),
                actual);
    }

    public Set<TokenType> getExpected() {
        return expected;
    }

    public Token getActual() {
        return actual;
    }

    private static String buildMessage(EvaluationErrorCode errorCode, Set<TokenType> expected, Token actual) {
        String what = errorCode == EvaluationErrorCode.EXPECTED_OPERAND ? "operand" : "operator";
        String kinds = expected.stream().map(TokenType::describe).collect(Collectors.joining(", "));
        String found = actual.type() == TokenType.INTEGER
                ? "integer " + actual.text()
                : actual.type().describe();
        return String.format("Expected %s (%s) but found %s", what, kinds, found);
    }
}
