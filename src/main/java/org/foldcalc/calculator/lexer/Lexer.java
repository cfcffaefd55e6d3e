package org.foldcalc.calculator.lexer;

import org.foldcalc.calculator.api.LexicalException;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts a single input line
 * into tokens, one token per call to {@link #nextToken()}.
 * <p>
 * The sequence is lazy and cannot be rewound. Once the end of the line has been
 * reached every further call returns {@link Token.EndOfInput}. Instances are not
 * thread-safe; each line gets its own lexer.
 */
public class Lexer {

    private final String source;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The input line. Must not contain the line terminator.
     */
    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Scans the next token.
     * @return The next token, or {@link Token.EndOfInput} if the line is exhausted.
     * @throws LexicalException if the next non-whitespace character starts no valid token.
     */
    public Token nextToken() throws LexicalException {
        skipWhitespace();
        if (isAtEnd()) {
            return new Token.EndOfInput(current + 1);
        }

        int start = current;
        char c = advance();
        switch (c) {
            case '+': return new Token.Operator(TokenType.PLUS, start + 1);
            case '-': return new Token.Operator(TokenType.MINUS, start + 1);
            case '*': return new Token.Operator(TokenType.TIMES, start + 1);
            case '/': return new Token.Operator(TokenType.DIVIDE, start + 1);
            default:
                if (isDigit(c)) {
                    return integer(start);
                }
                throw new LexicalException(c, start + 1);
        }
    }

    private Token integer(int start) {
        while (isDigit(peek())) advance();
        return new Token.IntegerLiteral(new BigInteger(source.substring(start, current)), start + 1);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    // ASCII only; other Unicode digits are lexical errors.
    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
