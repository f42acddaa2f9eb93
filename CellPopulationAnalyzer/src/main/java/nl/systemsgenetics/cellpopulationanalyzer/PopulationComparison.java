package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;

/**
 * Outcome of comparing responders and non-responders for a single population.
 * P-values are NaN when one of the groups was empty.
 */
public class PopulationComparison {

    private final CellPopulation population;
    private final int responderCount;
    private final int nonResponderCount;
    private final double pValue;
    private final double adjustedPValue;
    private final boolean significant;

    PopulationComparison(CellPopulation population, int responderCount, int nonResponderCount,
                         double pValue, double adjustedPValue, boolean significant) {
        this.population = population;
        this.responderCount = responderCount;
        this.nonResponderCount = nonResponderCount;
        this.pValue = pValue;
        this.adjustedPValue = adjustedPValue;
        this.significant = significant;
    }

    public CellPopulation getPopulation() {
        return population;
    }

    public int getResponderCount() {
        return responderCount;
    }

    public int getNonResponderCount() {
        return nonResponderCount;
    }

    public double getPValue() {
        return pValue;
    }

    public double getAdjustedPValue() {
        return adjustedPValue;
    }

    public boolean isSignificant() {
        return significant;
    }

    @Override
    public String toString() {
        return String.format("%s: n_yes=%d, n_no=%d, p=%s, p_adj=%s%s",
                population, responderCount, nonResponderCount, pValue, adjustedPValue,
                significant ? " (significant)" : "");
    }
}
