package org.foldcalc.calculator.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A non-negative integer literal. */
    INTEGER(null),

    // Operators.
    /** The '+' character. */
    PLUS('+'),
    /** The '-' character. */
    MINUS('-'),
    /** The '*' character. */
    TIMES('*'),
    /** The '/' character. */
    DIVIDE('/'),

    /** Represents the end of the input line. */
    END_OF_INPUT(null);

    private final Character symbol;

    TokenType(Character symbol) {
        this.symbol = symbol;
    }

    /**
     * @return {@code true} for the four binary operator kinds.
     */
    public boolean isOperator() {
        return symbol != null;
    }

    /**
     * Returns the literal symbol of an operator kind.
     * @return The operator character.
     * @throws IllegalStateException if this kind is not an operator.
     */
    public char symbol() {
        if (symbol == null) {
            throw new IllegalStateException(name() + " has no symbol");
        }
        return symbol;
    }

    /**
     * Human readable name used in diagnostics.
     * @return e.g. "integer", "'+'" or "end of input".
     */
    public String describe() {
        return switch (this) {
            case INTEGER -> "integer";
            case END_OF_INPUT -> "end of input";
            default -> "'" + symbol + "'";
        };
    }
}
