package nl.systemsgenetics.cellpopulationanalyzer.model;

import java.util.Objects;

/**
 * The number of cells of one population counted in one sample.
 */
public class PopulationCount {

    private final String sampleId;
    private final CellPopulation population;
    private final long count;

    public PopulationCount(String sampleId, CellPopulation population, long count) {
        if (count < 0) {
            throw new IllegalArgumentException(String.format(
                    "Negative count for %s in sample %s: %d", population, sampleId, count));
        }
        this.sampleId = Objects.requireNonNull(sampleId, "sampleId");
        this.population = Objects.requireNonNull(population, "population");
        this.count = count;
    }

    public String getSampleId() {
        return sampleId;
    }

    public CellPopulation getPopulation() {
        return population;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PopulationCount that = (PopulationCount) o;
        return count == that.count && sampleId.equals(that.sampleId) && population == that.population;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleId, population, count);
    }

    @Override
    public String toString() {
        return sampleId + ":" + population + "=" + count;
    }
}
