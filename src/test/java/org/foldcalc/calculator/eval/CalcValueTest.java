package org.foldcalc.calculator.eval;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the arithmetic and the textual form of {@link CalcValue}.
 */
@Tag("unit")
class CalcValueTest {

    private static final BigInteger TWO = BigInteger.valueOf(2);
    private static final BigInteger THREE = BigInteger.valueOf(3);

    @Test
    void wholeArithmeticStaysWhole() {
        CalcValue value = CalcValue.of(BigInteger.TEN).plus(TWO).minus(THREE).times(TWO);

        assertThat(value).isEqualTo(new CalcValue.Whole(BigInteger.valueOf(18)));
    }

    @Test
    void exactDivisionStillYieldsAReal() {
        assertThat(CalcValue.of(BigInteger.TEN).dividedBy(TWO)).isEqualTo(new CalcValue.Real(5.0));
    }

    @Test
    void realStaysRealAfterFurtherOperations() {
        CalcValue value = CalcValue.of(BigInteger.ONE).dividedBy(TWO).plus(TWO).times(THREE);

        assertThat(value).isInstanceOf(CalcValue.Real.class);
        assertThat(value.render()).isEqualTo("7.5");
    }

    /**
     * Small operands are divided as doubles, giving the nearest double to the true quotient.
     */
    @Test
    void divisionOfSmallWholesIsCorrectlyRounded() {
        assertThat(CalcValue.of(TWO).dividedBy(THREE)).isEqualTo(new CalcValue.Real(2.0 / 3.0));
        assertThat(CalcValue.of(BigInteger.TEN).dividedBy(THREE)).isEqualTo(new CalcValue.Real(10.0 / 3.0));
        assertThat(CalcValue.of(BigInteger.valueOf(-1)).dividedBy(THREE).render()).isEqualTo("-0.3333333333333333");
    }

    @Test
    void divisionBeyondDoublePrecisionIsCorrectlyRounded() {
        BigInteger numerator = BigInteger.TWO.pow(60).multiply(TWO);
        BigInteger denominator = BigInteger.TWO.pow(60).multiply(THREE);

        assertThat(CalcValue.of(numerator).dividedBy(denominator)).isEqualTo(new CalcValue.Real(2.0 / 3.0));
    }

    @Test
    void divisionOfLargeIntegersKeepsPrecision() {
        BigInteger large = new BigInteger("100000000000000000000000000000");
        CalcValue value = CalcValue.of(large.add(BigInteger.ONE)).dividedBy(large);

        assertThat(value.render()).isEqualTo("1.0");
    }

    @Test
    void rendersWholesInPlainDecimal() {
        assertThat(CalcValue.of(new BigInteger("-12345678901234567890")).render()).isEqualTo("-12345678901234567890");
    }

    @Test
    void rendersRealsWithAFractionalDigit() {
        assertThat(new CalcValue.Real(4.0).render()).isEqualTo("4.0");
        assertThat(new CalcValue.Real(0.5).render()).isEqualTo("0.5");
        assertThat(new CalcValue.Real(-2.25).render()).isEqualTo("-2.25");
        assertThat(new CalcValue.Real(1.0 / 3.0).render()).isEqualTo("0.3333333333333333");
        assertThat(new CalcValue.Real(1.0e7).render()).isEqualTo("10000000.0");
        assertThat(new CalcValue.Real(0.0001).render()).isEqualTo("0.0001");
    }

    /**
     * Very large and very small magnitudes fall back to scientific notation.
     */
    @Test
    void rendersExtremeRealsInScientificNotation() {
        assertThat(new CalcValue.Real(1.0e16).render()).isEqualTo("1.0E16");
        assertThat(new CalcValue.Real(1.0e-5).render()).isEqualTo("1.0E-5");
        assertThat(new CalcValue.Real(Double.POSITIVE_INFINITY).render()).isEqualTo("Infinity");
        assertThat(new CalcValue.Real(Double.NaN).render()).isEqualTo("NaN");
    }

    @Test
    void rendersSignedZero() {
        assertThat(new CalcValue.Real(0.0).render()).isEqualTo("0.0");
        assertThat(new CalcValue.Real(-3.0).times(BigInteger.ZERO).render()).isEqualTo("-0.0");
    }
}
