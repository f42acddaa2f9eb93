package nl.systemsgenetics.cellpopulationanalyzer;

import com.google.common.collect.ImmutableList;
import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;

import java.util.List;

/**
 * The four derived outputs of an analysis of a cohort.
 */
public class AnalysisResults {

    private final CohortDefinition cohort;
    private final ImmutableList<SampleFrequency> summary;
    private final ImmutableList<CohortFrequency> comparison;
    private final ImmutableList<PopulationComparison> statistics;
    private final ImmutableList<BaselineSample> baselineSamples;
    private final BaselineBreakdown baselineBreakdown;

    AnalysisResults(CohortDefinition cohort,
                    List<SampleFrequency> summary,
                    List<CohortFrequency> comparison,
                    List<PopulationComparison> statistics,
                    List<BaselineSample> baselineSamples,
                    BaselineBreakdown baselineBreakdown) {
        this.cohort = cohort;
        this.summary = ImmutableList.copyOf(summary);
        this.comparison = ImmutableList.copyOf(comparison);
        this.statistics = ImmutableList.copyOf(statistics);
        this.baselineSamples = ImmutableList.copyOf(baselineSamples);
        this.baselineBreakdown = baselineBreakdown;
    }

    public CohortDefinition getCohort() {
        return cohort;
    }

    /**
     * @return Frequencies of every population in every sample in the store.
     */
    public ImmutableList<SampleFrequency> getSummary() {
        return summary;
    }

    /**
     * @return Frequencies of every population in the samples of the cohort.
     */
    public ImmutableList<CohortFrequency> getComparison() {
        return comparison;
    }

    /**
     * @return Responder versus non-responder statistics per population.
     */
    public ImmutableList<PopulationComparison> getStatistics() {
        return statistics;
    }

    public ImmutableList<BaselineSample> getBaselineSamples() {
        return baselineSamples;
    }

    public BaselineBreakdown getBaselineBreakdown() {
        return baselineBreakdown;
    }
}
