package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.stats.BenjaminiHochbergCorrector;
import nl.systemsgenetics.stats.MannWhitneyUTest;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Compares the relative frequency of every cell population between responders and non-responders
 * with a two-sided Mann-Whitney U test, and corrects the p-values for multiple testing with
 * the Benjamini-Hochberg procedure.
 */
public class ResponderComparison {

    private static final Logger LOGGER = Logger.getLogger(ResponderComparison.class);

    private final MannWhitneyUTest mannWhitneyUTest = new MannWhitneyUTest();
    private final double alpha;

    /**
     * @param alpha Threshold below which an adjusted p-value is considered significant.
     */
    public ResponderComparison(double alpha) {
        if (!(alpha > 0 && alpha <= 1)) {
            throw new IllegalArgumentException(String.format("Significance threshold should be in (0, 1]: %s", alpha));
        }
        this.alpha = alpha;
    }

    public ResponderComparison() {
        this(BenjaminiHochbergCorrector.DEFAULT_ALPHA);
    }

    /**
     * Tests every population in the fixed population order.
     *
     * @param frequencies Frequencies of the cohort, annotated with the response.
     *                    Rows with a response other than yes or no are ignored.
     * @return One comparison per population, in {@link CellPopulation} declaration order.
     */
    public List<PopulationComparison> compare(Collection<CohortFrequency> frequencies) {
        CellPopulation[] populations = CellPopulation.values();

        Map<CellPopulation, List<Double>> responders = new EnumMap<>(CellPopulation.class);
        Map<CellPopulation, List<Double>> nonResponders = new EnumMap<>(CellPopulation.class);
        for (CellPopulation population : populations) {
            responders.put(population, new ArrayList<>());
            nonResponders.put(population, new ArrayList<>());
        }

        for (CohortFrequency frequency : frequencies) {
            if (Sample.RESPONDER.equals(frequency.getResponse())) {
                responders.get(frequency.getPopulation()).add(frequency.getPercentage());
            } else if (Sample.NON_RESPONDER.equals(frequency.getResponse())) {
                nonResponders.get(frequency.getPopulation()).add(frequency.getPercentage());
            }
        }

        double[] pValues = new double[populations.length];
        for (int i = 0; i < populations.length; i++) {
            pValues[i] = test(
                    toArray(responders.get(populations[i])),
                    toArray(nonResponders.get(populations[i])));
        }

        double[] adjustedPValues = BenjaminiHochbergCorrector.adjust(pValues);

        List<PopulationComparison> comparisons = new ArrayList<>(populations.length);
        for (int i = 0; i < populations.length; i++) {
            CellPopulation population = populations[i];
            PopulationComparison comparison = new PopulationComparison(
                    population,
                    responders.get(population).size(),
                    nonResponders.get(population).size(),
                    pValues[i],
                    adjustedPValues[i],
                    BenjaminiHochbergCorrector.isSignificant(adjustedPValues[i], alpha));
            LOGGER.debug(comparison);
            comparisons.add(comparison);
        }
        return comparisons;
    }

    /**
     * @return The two-sided p-value, or NaN if either group is empty.
     */
    double test(double[] responderPercentages, double[] nonResponderPercentages) {
        if (responderPercentages.length == 0 || nonResponderPercentages.length == 0) {
            return Double.NaN;
        }
        return mannWhitneyUTest.mannWhitneyUTest(responderPercentages, nonResponderPercentages);
    }

    public double getAlpha() {
        return alpha;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
