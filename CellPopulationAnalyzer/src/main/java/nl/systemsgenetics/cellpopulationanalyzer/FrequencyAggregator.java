package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import org.apache.commons.math3.util.Precision;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Turns raw population counts into per-sample relative frequencies.
 */
public class FrequencyAggregator {

    private static final Logger LOGGER = Logger.getLogger(FrequencyAggregator.class);
    static final int PERCENTAGE_DECIMALS = 3;

    /**
     * Orders counts by sample identifier, then by the stored population identifier.
     */
    static final Comparator<PopulationCount> SAMPLE_POPULATION_ORDER = Comparator
            .comparing(PopulationCount::getSampleId)
            .thenComparing(count -> count.getPopulation().getLabel());

    /**
     * Builds the summary table: for every sample and population the count, the sample total and the
     * percentage of the total, rounded to three decimals.
     *
     * @param populationCounts All population counts.
     * @return Rows ordered by sample identifier, then population identifier.
     * @throws DataIntegrityException if a sample does not have exactly one count per population,
     * or if its counts sum to zero.
     */
    public List<SampleFrequency> summarize(Collection<PopulationCount> populationCounts)
            throws DataIntegrityException {

        Map<String, Long> totals = calculateSampleTotals(populationCounts);

        List<PopulationCount> orderedCounts = new ArrayList<>(populationCounts);
        orderedCounts.sort(SAMPLE_POPULATION_ORDER);

        List<SampleFrequency> frequencies = new ArrayList<>(orderedCounts.size());
        for (PopulationCount populationCount : orderedCounts) {
            long total = totals.get(populationCount.getSampleId());
            frequencies.add(new SampleFrequency(
                    populationCount.getSampleId(),
                    total,
                    populationCount.getPopulation(),
                    populationCount.getCount(),
                    Precision.round(percentage(populationCount.getCount(), total), PERCENTAGE_DECIMALS)));
        }

        LOGGER.debug(String.format("Calculated %d frequencies for %d samples", frequencies.size(), totals.size()));
        return frequencies;
    }

    /**
     * Sums the counts per sample, checking that every sample has one count for each of the fixed populations
     * and a positive total.
     *
     * @param populationCounts The counts to sum.
     * @return A map with sample identifiers as keys and total cell counts as values.
     * @throws DataIntegrityException if a sample lacks a population, has a population twice or sums to zero.
     */
    static Map<String, Long> calculateSampleTotals(Collection<PopulationCount> populationCounts)
            throws DataIntegrityException {

        Map<String, EnumMap<CellPopulation, Long>> countsPerSample = new LinkedHashMap<>();

        for (PopulationCount populationCount : populationCounts) {
            EnumMap<CellPopulation, Long> sampleCounts = countsPerSample.computeIfAbsent(
                    populationCount.getSampleId(), sampleId -> new EnumMap<>(CellPopulation.class));

            if (sampleCounts.put(populationCount.getPopulation(), populationCount.getCount()) != null) {
                throw new DataIntegrityException(String.format(
                        "Sample '%s' has more than one count for population '%s'",
                        populationCount.getSampleId(), populationCount.getPopulation()));
            }
        }

        Map<String, Long> totals = new LinkedHashMap<>(countsPerSample.size());
        for (Map.Entry<String, EnumMap<CellPopulation, Long>> entry : countsPerSample.entrySet()) {
            String sampleId = entry.getKey();
            EnumMap<CellPopulation, Long> sampleCounts = entry.getValue();

            if (sampleCounts.size() != CellPopulation.values().length) {
                EnumSet<CellPopulation> missing = EnumSet.allOf(CellPopulation.class);
                missing.removeAll(sampleCounts.keySet());
                throw new DataIntegrityException(String.format(
                        "Sample '%s' is missing counts for population(s) %s", sampleId, missing));
            }

            long total = 0;
            for (long count : sampleCounts.values()) {
                total += count;
            }
            if (total <= 0) {
                throw new DataIntegrityException(String.format(
                        "Sample '%s' has a total cell count of %d, frequencies are undefined", sampleId, total));
            }
            totals.put(sampleId, total);
        }
        return totals;
    }

    static double percentage(long count, long total) {
        return (count * 100.0) / total;
    }
}
