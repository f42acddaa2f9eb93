package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;

/**
 * Relative frequency of one population in one sample of a cohort, annotated with the response.
 */
public class CohortFrequency {

    private final String sampleId;
    private final String response;
    private final CellPopulation population;
    private final long count;
    private final double percentage;

    CohortFrequency(String sampleId, String response, CellPopulation population, long count, double percentage) {
        this.sampleId = sampleId;
        this.response = response;
        this.population = population;
        this.count = count;
        this.percentage = percentage;
    }

    public String getSampleId() {
        return sampleId;
    }

    public String getResponse() {
        return response;
    }

    public CellPopulation getPopulation() {
        return population;
    }

    public long getCount() {
        return count;
    }

    /**
     * @return The unrounded percentage.
     */
    public double getPercentage() {
        return percentage;
    }
}
