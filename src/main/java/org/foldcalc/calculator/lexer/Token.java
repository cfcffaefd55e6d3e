package org.foldcalc.calculator.lexer;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Represents a single token extracted from an input line by the {@link Lexer}.
 * <p>
 * The payload of a token is determined by its variant: only {@link IntegerLiteral}
 * carries a number, {@link Operator} carries nothing beyond its kind, and
 * {@link EndOfInput} carries nothing at all.
 */
public sealed interface Token permits Token.IntegerLiteral, Token.Operator, Token.EndOfInput {

    /**
     * @return The kind of this token.
     */
    TokenType type();

    /**
     * @return The 1-based column where the token begins.
     */
    int column();

    /**
     * @return The token as it appeared in the source line, for diagnostics.
     */
    String text();

    /**
     * A non-negative integer literal.
     *
     * @param value The numeric value of the digit run.
     * @param column The column of the first digit.
     */
    record IntegerLiteral(BigInteger value, int column) implements Token {
        public IntegerLiteral {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Integer literals are non-negative: " + value);
            }
        }

        @Override
        public TokenType type() {
            return TokenType.INTEGER;
        }

        @Override
        public String text() {
            return value.toString();
        }
    }

    /**
     * One of the four binary operators.
     *
     * @param type The operator kind; must satisfy {@link TokenType#isOperator()}.
     * @param column The column of the operator character.
     */
    record Operator(TokenType type, int column) implements Token {
        public Operator {
            Objects.requireNonNull(type, "type");
            if (!type.isOperator()) {
                throw new IllegalArgumentException(type + " is not an operator");
            }
        }

        /**
         * @return The operator character.
         */
        public char symbol() {
            return type.symbol();
        }

        @Override
        public String text() {
            return String.valueOf(type.symbol());
        }
    }

    /**
     * Marks the end of the line.
     *
     * @param column One past the last column of the line.
     */
    record EndOfInput(int column) implements Token {
        @Override
        public TokenType type() {
            return TokenType.END_OF_INPUT;
        }

        @Override
        public String text() {
            return "";
        }
    }
}
