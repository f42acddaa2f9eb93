package nl.systemsgenetics.cellpopulationanalyzer;

import com.google.common.collect.ImmutableMap;

/**
 * Grouped counts over the baseline samples of a cohort.
 */
public class BaselineBreakdown {

    private final ImmutableMap<String, Integer> samplesPerProject;
    private final ImmutableMap<String, Integer> subjectsByResponse;
    private final ImmutableMap<String, Integer> subjectsBySex;

    BaselineBreakdown(ImmutableMap<String, Integer> samplesPerProject,
                      ImmutableMap<String, Integer> subjectsByResponse,
                      ImmutableMap<String, Integer> subjectsBySex) {
        this.samplesPerProject = samplesPerProject;
        this.subjectsByResponse = subjectsByResponse;
        this.subjectsBySex = subjectsBySex;
    }

    /**
     * @return Number of distinct baseline samples per project.
     */
    public ImmutableMap<String, Integer> getSamplesPerProject() {
        return samplesPerProject;
    }

    /**
     * @return Number of distinct subjects per response, each subject counted once.
     */
    public ImmutableMap<String, Integer> getSubjectsByResponse() {
        return subjectsByResponse;
    }

    /**
     * @return Number of distinct subjects per sex, each subject counted once.
     */
    public ImmutableMap<String, Integer> getSubjectsBySex() {
        return subjectsBySex;
    }
}
