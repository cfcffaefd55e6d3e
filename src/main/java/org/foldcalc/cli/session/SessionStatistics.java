package org.foldcalc.cli.session;

/**
 * Counts of what a {@link CalculatorSession} did with its input.
 *
 * @param evaluated Lines that produced a result.
 * @param failed Lines that produced an error.
 * @param skipped Blank lines that were not evaluated.
 */
public record SessionStatistics(int evaluated, int failed, int skipped) {
}
