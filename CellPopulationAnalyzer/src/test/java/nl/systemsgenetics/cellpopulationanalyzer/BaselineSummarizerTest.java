package nl.systemsgenetics.cellpopulationanalyzer;

import com.google.common.collect.ImmutableMap;
import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.testng.Assert.*;

public class BaselineSummarizerTest {

    private final BaselineSummarizer baselineSummarizer = new BaselineSummarizer();

    @Test
    public void testSummarizeToyDataset() {
        CohortSelector cohortSelector = new CohortSelector(
                ToyDataset.subjects(), ToyDataset.samples(), ToyDataset.populationCounts());

        BaselineBreakdown breakdown = baselineSummarizer.summarize(
                cohortSelector.selectBaselineSamples(CohortDefinition.defaultResponderCohort()));

        assertEquals(breakdown.getSamplesPerProject(), ImmutableMap.of("prj1", 2, "prj2", 1));
        assertEquals(breakdown.getSubjectsByResponse(), ImmutableMap.of("no", 1, "yes", 1));
        assertEquals(breakdown.getSubjectsBySex(), ImmutableMap.of("F", 1, "M", 1));
    }

    @Test
    public void testSubjectCountedOnce() {
        // The same subject with conflicting responses keeps its first row
        BaselineBreakdown breakdown = baselineSummarizer.summarize(Arrays.asList(
                new BaselineSample("a1", "prjB", "sbjX", "yes", "F", 0),
                new BaselineSample("a2", "prjA", "sbjX", "no", "F", 0),
                new BaselineSample("a3", "prjA", "sbjY", "no", null, 0)));

        assertEquals(breakdown.getSamplesPerProject(), ImmutableMap.of("prjA", 2, "prjB", 1));
        assertEquals(breakdown.getSamplesPerProject().keySet().asList(), Arrays.asList("prjA", "prjB"));
        assertEquals(breakdown.getSubjectsByResponse(), ImmutableMap.of("no", 1, "yes", 1));
        assertEquals(breakdown.getSubjectsBySex(), ImmutableMap.of("", 1, "F", 1));
    }

    @Test
    public void testSummarizeEmpty() {
        BaselineBreakdown breakdown = baselineSummarizer.summarize(Collections.emptyList());

        assertTrue(breakdown.getSamplesPerProject().isEmpty());
        assertTrue(breakdown.getSubjectsByResponse().isEmpty());
        assertTrue(breakdown.getSubjectsBySex().isEmpty());
    }
}
