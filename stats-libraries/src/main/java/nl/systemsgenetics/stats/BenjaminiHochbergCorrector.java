package nl.systemsgenetics.stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Benjamini-Hochberg step-up procedure for controlling the false discovery rate.
 *
 * Missing p-values (NaN) do not count as hypotheses: they are left out of the number of tests
 * and out of the ranking, and are reported as NaN in the adjusted output.
 */
public final class BenjaminiHochbergCorrector {

    public static final double DEFAULT_ALPHA = 0.05;

    private BenjaminiHochbergCorrector() {
    }

    /**
     * Adjusts raw p-values for multiple testing.
     *
     * @param pValues Raw p-values in [0, 1], or NaN for tests that were not performed.
     *                The array is not modified.
     * @return Adjusted p-values in the order of the input.
     * @throws IllegalArgumentException if a p-value is not NaN and lies outside [0, 1].
     */
    public static double[] adjust(double[] pValues) {
        double[] adjusted = new double[pValues.length];
        Arrays.fill(adjusted, Double.NaN);

        // Collect the indices of the tests that were actually performed
        List<Integer> order = new ArrayList<>(pValues.length);
        for (int i = 0; i < pValues.length; i++) {
            double pValue = pValues[i];
            if (Double.isNaN(pValue)) {
                continue;
            }
            if (pValue < 0 || pValue > 1) {
                throw new IllegalArgumentException(String.format(
                        "P-value at index %d is not in [0, 1]: %s", i, pValue));
            }
            order.add(i);
        }

        // Stable sort, equal p-values keep their input order
        order.sort(Comparator.comparingDouble(index -> pValues[index]));

        int numberOfTests = order.size();
        double runningMinimum = 1;
        for (int rank = numberOfTests; rank >= 1; rank--) {
            int index = order.get(rank - 1);
            double candidate = pValues[index] * numberOfTests / rank;
            runningMinimum = Math.min(runningMinimum, candidate);
            adjusted[index] = Math.max(0, runningMinimum);
        }
        return adjusted;
    }

    /**
     * @return true if the adjusted p-value is below alpha. NaN is never significant.
     */
    public static boolean isSignificant(double adjustedPValue, double alpha) {
        return !Double.isNaN(adjustedPValue) && adjustedPValue < alpha;
    }
}
