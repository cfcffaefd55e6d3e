package org.foldcalc.calculator.eval;

import org.foldcalc.calculator.api.DivisionByZeroException;
import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.api.SyntaxException;
import org.foldcalc.calculator.lexer.Lexer;
import org.foldcalc.calculator.lexer.Token;

import java.util.Objects;

/**
 * Folds the tokens of one line into a single value, strictly left to right.
 * <p>
 * There is no operator precedence: {@code 2 + 3 * 4} evaluates as {@code (2 + 3) * 4}.
 * The accepted grammar is {@code INTEGER (OPERATOR INTEGER)* END_OF_INPUT}: the first
 * operand seeds the accumulator, then each (operator, operand) pair is folded into it.
 * An evaluator pulls tokens from its {@link Lexer} on demand and can be run only once.
 */
public class Evaluator {

    private final Lexer lexer;
    private boolean consumed = false;

    /**
     * Creates a new Evaluator.
     * @param lexer A fresh lexer over the line to evaluate.
     */
    public Evaluator(Lexer lexer) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
    }

    /**
     * Evaluates the whole line.
     * @return The final accumulator.
     * @throws EvaluationException on the first lexical, syntax or division-by-zero error.
     * @throws IllegalStateException if this evaluator has already been run.
     */
    public CalcValue evaluate() throws EvaluationException {
        if (consumed) {
            throw new IllegalStateException("Evaluator has already consumed its input");
        }
        consumed = true;

        CalcValue accumulator = CalcValue.of(expectOperand().value());
        Token token = lexer.nextToken();
        while (!(token instanceof Token.EndOfInput)) {
            Token.Operator operator = expectOperator(token);
            accumulator = apply(accumulator, operator, expectOperand());
            token = lexer.nextToken();
        }
        return accumulator;
    }

    private Token.IntegerLiteral expectOperand() throws EvaluationException {
        Token token = lexer.nextToken();
        if (token instanceof Token.IntegerLiteral literal) {
            return literal;
        }
        throw SyntaxException.expectedOperand(token);
    }

    private Token.Operator expectOperator(Token token) throws SyntaxException {
        if (token instanceof Token.Operator operator) {
            return operator;
        }
        throw SyntaxException.expectedOperator(token);
    }

    private CalcValue apply(CalcValue left, Token.Operator operator, Token.IntegerLiteral right) throws DivisionByZeroException {
        return switch (operator.type()) {
            case PLUS -> left.plus(right.value());
            case MINUS -> left.minus(right.value());
            case TIMES -> left.times(right.value());
            case DIVIDE -> {
                if (right.value().signum() == 0) {
                    throw new DivisionByZeroException(right.column());
                }
                yield left.dividedBy(right.value());
            }
            default -> throw new IllegalStateException("Not an operator: " + operator.type());
        };
    }
}
