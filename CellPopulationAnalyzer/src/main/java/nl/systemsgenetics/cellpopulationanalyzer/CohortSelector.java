package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;
import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.cellpopulationanalyzer.model.Subject;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Joins subjects, samples and counts and filters them down to the samples of a cohort.
 */
public class CohortSelector {

    private static final Logger LOGGER = Logger.getLogger(CohortSelector.class);

    private final Map<String, Subject> subjects;
    private final List<Sample> samples;
    private final Map<String, List<PopulationCount>> countsPerSample;

    public CohortSelector(Collection<Subject> subjects,
                          Collection<Sample> samples,
                          Collection<PopulationCount> populationCounts) {
        this.subjects = new HashMap<>();
        for (Subject subject : subjects) {
            this.subjects.put(subject.getSubjectId(), subject);
        }

        this.samples = new ArrayList<>(samples);
        this.samples.sort(Comparator.comparing(Sample::getSampleId));

        this.countsPerSample = new HashMap<>();
        for (PopulationCount populationCount : populationCounts) {
            this.countsPerSample
                    .computeIfAbsent(populationCount.getSampleId(), sampleId -> new ArrayList<>())
                    .add(populationCount);
        }
    }

    /**
     * Gets the samples that belong to the given cohort.
     *
     * @param cohort The cohort definition to filter with.
     * @return The matching samples, ordered by sample identifier. Empty if nothing matches.
     */
    public List<Sample> selectSamples(CohortDefinition cohort) {
        List<Sample> selection = new ArrayList<>();
        for (Sample sample : samples) {
            if (cohort.doesSamplePassFilter(subjects.get(sample.getSubjectId()), sample)) {
                selection.add(sample);
            }
        }
        LOGGER.debug(String.format("%d / %d samples pass cohort filter (%s)",
                selection.size(), samples.size(), cohort));
        return selection;
    }

    /**
     * Calculates the unrounded relative frequency of every population in every sample of the cohort.
     *
     * @param cohort The cohort definition to filter with.
     * @return One row per sample and population, ordered by sample identifier, then population identifier.
     * Empty if no sample matches.
     * @throws DataIntegrityException if the counts of a selected sample cannot be turned into frequencies.
     */
    public List<CohortFrequency> selectFrequencies(CohortDefinition cohort) throws DataIntegrityException {
        List<CohortFrequency> frequencies = new ArrayList<>();

        for (Sample sample : selectSamples(cohort)) {
            List<PopulationCount> sampleCounts = countsPerSample.getOrDefault(
                    sample.getSampleId(), Collections.emptyList());

            if (sampleCounts.isEmpty()) {
                throw new DataIntegrityException(String.format(
                        "Sample '%s' is missing counts for population(s) %s",
                        sample.getSampleId(), EnumSet.allOf(CellPopulation.class)));
            }

            long total = FrequencyAggregator.calculateSampleTotals(sampleCounts).get(sample.getSampleId());

            List<PopulationCount> orderedCounts = new ArrayList<>(sampleCounts);
            orderedCounts.sort(FrequencyAggregator.SAMPLE_POPULATION_ORDER);
            for (PopulationCount populationCount : orderedCounts) {
                frequencies.add(new CohortFrequency(
                        sample.getSampleId(),
                        sample.getResponse(),
                        populationCount.getPopulation(),
                        populationCount.getCount(),
                        FrequencyAggregator.percentage(populationCount.getCount(), total)));
            }
        }
        return frequencies;
    }

    /**
     * Gets the baseline samples of a cohort, joined with the sex of their subject.
     * The response restriction of the cohort is dropped, so samples with an unknown response are included.
     *
     * @param cohort The cohort to take the baseline samples from.
     * @return The baseline rows, ordered by sample identifier.
     */
    public List<BaselineSample> selectBaselineSamples(CohortDefinition cohort) {
        List<BaselineSample> baselineSamples = new ArrayList<>();
        for (Sample sample : selectSamples(cohort.baseline())) {
            Subject subject = subjects.get(sample.getSubjectId());
            baselineSamples.add(new BaselineSample(
                    sample.getSampleId(),
                    sample.getProject(),
                    sample.getSubjectId(),
                    sample.getResponse(),
                    subject == null ? null : subject.getSex(),
                    sample.getTimeFromTreatmentStart()));
        }
        return baselineSamples;
    }
}
