package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;

/**
 * Relative frequency of one population in one sample, as reported in the summary table.
 */
public class SampleFrequency {

    private final String sampleId;
    private final long totalCount;
    private final CellPopulation population;
    private final long count;
    private final double percentage;

    SampleFrequency(String sampleId, long totalCount, CellPopulation population, long count, double percentage) {
        this.sampleId = sampleId;
        this.totalCount = totalCount;
        this.population = population;
        this.count = count;
        this.percentage = percentage;
    }

    public String getSampleId() {
        return sampleId;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public CellPopulation getPopulation() {
        return population;
    }

    public long getCount() {
        return count;
    }

    /**
     * @return The percentage of cells in this sample belonging to the population, rounded to 3 decimals.
     */
    public double getPercentage() {
        return percentage;
    }
}
