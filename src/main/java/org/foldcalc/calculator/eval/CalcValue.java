package org.foldcalc.calculator.eval;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * The running accumulator of an evaluation.
 * <p>
 * Integer arithmetic stays exact in {@link Whole}. Every division yields a {@link Real},
 * even when the quotient is whole, and a real stays real for the rest of the line.
 */
public sealed interface CalcValue permits CalcValue.Whole, CalcValue.Real {

    /**
     * @param value An integer.
     * @return The exact value.
     */
    static CalcValue of(BigInteger value) {
        return new Whole(value);
    }

    CalcValue plus(BigInteger right);

    CalcValue minus(BigInteger right);

    CalcValue times(BigInteger right);

    /**
     * Real division. The caller rejects a zero divisor.
     * @param right A non-zero divisor.
     * @return The quotient as a {@link Real}.
     */
    Real dividedBy(BigInteger right);

    /**
     * @return The value in its stable textual form, e.g. {@code 8}, {@code 4.0} or {@code 0.5}.
     */
    String render();

    /**
     * An exact integer.
     * @param value The integer value.
     */
    record Whole(BigInteger value) implements CalcValue {

        private static final int EXACT_DOUBLE_BITS = 53;
        private static final MathContext WIDE_DIVISION = new MathContext(40, RoundingMode.HALF_EVEN);

        public Whole {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public CalcValue plus(BigInteger right) {
            return new Whole(value.add(right));
        }

        @Override
        public CalcValue minus(BigInteger right) {
            return new Whole(value.subtract(right));
        }

        @Override
        public CalcValue times(BigInteger right) {
            return new Whole(value.multiply(right));
        }

        @Override
        public Real dividedBy(BigInteger right) {
            // Both operands exact as doubles: IEEE division is correctly rounded.
            if (value.bitLength() <= EXACT_DOUBLE_BITS && right.bitLength() <= EXACT_DOUBLE_BITS) {
                return new Real(value.doubleValue() / right.doubleValue());
            }
            BigDecimal quotient = new BigDecimal(value).divide(new BigDecimal(right), WIDE_DIVISION);
            return new Real(quotient.doubleValue());
        }

        @Override
        public String render() {
            return value.toString();
        }
    }

    /**
     * A double precision value.
     * @param value The floating point value.
     */
    record Real(double value) implements CalcValue {

        private static final double PLAIN_LOWER_BOUND = 1e-4;
        private static final double PLAIN_UPPER_BOUND = 1e16;

        @Override
        public CalcValue plus(BigInteger right) {
            return new Real(value + right.doubleValue());
        }

        @Override
        public CalcValue minus(BigInteger right) {
            return new Real(value - right.doubleValue());
        }

        @Override
        public CalcValue times(BigInteger right) {
            return new Real(value * right.doubleValue());
        }

        @Override
        public Real dividedBy(BigInteger right) {
            return new Real(value / right.doubleValue());
        }

        @Override
        public String render() {
            if (value == 0.0) {
                return 1.0 / value < 0 ? "-0.0" : "0.0";
            }
            double magnitude = Math.abs(value);
            if (Double.isFinite(value) && magnitude >= PLAIN_LOWER_BOUND && magnitude < PLAIN_UPPER_BOUND) {
                String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
                return plain.indexOf('.') < 0 ? plain + ".0" : plain;
            }
            return Double.toString(value);
        }
    }
}
