package org.foldcalc.calculator.api;

/**
 * Thrown when a character is neither whitespace, a digit nor one of {@code + - * /}.
 */
public class LexicalException extends EvaluationException {

    private final char character;

    /**
     * @param character The offending character.
     * @param column Its 1-based column.
     */
    public LexicalException(char character, int column) {
        super(EvaluationErrorCode.UNEXPECTED_CHARACTER, column, "Unexpected character '" + character + "'");
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }
}
