package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.cellpopulationanalyzer.model.Subject;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.testng.Assert.*;

public class CohortSelectorTest {

    private List<Subject> subjects;
    private List<Sample> samples;
    private List<PopulationCount> counts;

    @BeforeMethod
    public void setUp() {
        subjects = new ArrayList<>(ToyDataset.subjects());
        subjects.add(new Subject("sbj3", "carcinoma", 71, "F"));
        subjects.add(new Subject("sbj4", "melanoma", 48, "M"));

        samples = new ArrayList<>(ToyDataset.samples());
        // Wrong condition
        samples.add(new Sample("s4", "prj2", "sbj3", "miraclib", "yes", "PBMC", 0));
        // Wrong treatment
        samples.add(new Sample("s5", "prj2", "sbj4", "phauximab", "no", "PBMC", 0));
        // Wrong sample type
        samples.add(new Sample("s6", "prj2", "sbj4", "miraclib", "no", "WB", 0));
        // Unknown response, later time point
        samples.add(new Sample("s7", "prj3", "sbj4", "miraclib", "", "PBMC", 7));
        // Unknown response at baseline
        samples.add(new Sample("s8", "prj3", "sbj4", "miraclib", null, "PBMC", 0));

        counts = new ArrayList<>(ToyDataset.populationCounts());
        for (String sampleId : Arrays.asList("s4", "s5", "s6", "s7", "s8")) {
            counts.addAll(ToyDataset.counts(sampleId, 10, 20, 30, 40, 50));
        }
    }

    @Test
    public void testSelectSamples() {
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        List<Sample> selection = cohortSelector.selectSamples(CohortDefinition.defaultResponderCohort());

        assertEquals(sampleIds(selection), Arrays.asList("s1", "s2", "s3"));
    }

    @Test
    public void testSelectFrequencies() throws DataIntegrityException {
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        List<CohortFrequency> frequencies = cohortSelector.selectFrequencies(
                CohortDefinition.defaultResponderCohort());

        assertEquals(frequencies.size(), 15);
        CohortFrequency first = frequencies.get(0);
        assertEquals(first.getSampleId(), "s1");
        assertEquals(first.getResponse(), "yes");
        assertEquals(first.getCount(), 100);
        assertEquals(first.getPercentage(), 10.0, 1e-12);

        // Unrounded
        CohortFrequency s2BCell = frequencies.get(5);
        assertEquals(s2BCell.getSampleId(), "s2");
        assertEquals(s2BCell.getPercentage(), 100.0 / 3, 1e-12);

        assertEquals(frequencies.get(10).getResponse(), "no");
    }

    @Test
    public void testGenericPredicates() throws DataIntegrityException {
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        CohortDefinition wholeBlood = new CohortDefinition(
                "melanoma", "miraclib", "WB", Collections.singleton("no"), null);
        assertEquals(sampleIds(cohortSelector.selectSamples(wholeBlood)), Collections.singletonList("s6"));

        CohortDefinition carcinoma = CohortDefinition.responderCohort("carcinoma", "miraclib", "PBMC");
        assertEquals(sampleIds(cohortSelector.selectSamples(carcinoma)), Collections.singletonList("s4"));

        CohortDefinition anyMelanoma = new CohortDefinition("melanoma", null, null, null, null);
        assertEquals(sampleIds(cohortSelector.selectSamples(anyMelanoma)),
                Arrays.asList("s1", "s2", "s3", "s5", "s6", "s7", "s8"));

        assertEquals(cohortSelector.selectFrequencies(wholeBlood).size(), 5);
    }

    @Test
    public void testEmptyCohort() throws DataIntegrityException {
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        CohortDefinition noMatches = CohortDefinition.responderCohort("melanoma", "placebo", "PBMC");

        assertTrue(cohortSelector.selectSamples(noMatches).isEmpty());
        assertTrue(cohortSelector.selectFrequencies(noMatches).isEmpty());
    }

    @Test
    public void testUnknownSubjectNeverMatchesCondition() {
        samples.add(new Sample("s9", "prj1", "unknown", "miraclib", "yes", "PBMC", 0));
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        assertFalse(sampleIds(cohortSelector.selectSamples(CohortDefinition.defaultResponderCohort()))
                .contains("s9"));
    }

    @Test(expectedExceptions = DataIntegrityException.class)
    public void testSelectedSampleWithoutCounts() throws DataIntegrityException {
        samples.add(new Sample("s9", "prj1", "sbj2", "miraclib", "no", "PBMC", 3));
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        cohortSelector.selectFrequencies(CohortDefinition.defaultResponderCohort());
    }

    @Test
    public void testIntegrityIsOnlyCheckedForSelectedSamples() throws DataIntegrityException {
        counts.addAll(ToyDataset.counts("s10", 0, 0, 0, 0, 0));
        samples.add(new Sample("s10", "prj1", "sbj3", "miraclib", "no", "PBMC", 0));
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        assertEquals(cohortSelector.selectFrequencies(CohortDefinition.defaultResponderCohort()).size(), 15);
    }

    @Test
    public void testSelectBaselineSamples() {
        CohortSelector cohortSelector = new CohortSelector(subjects, samples, counts);

        List<BaselineSample> baselineSamples = cohortSelector.selectBaselineSamples(
                CohortDefinition.defaultResponderCohort());

        // The response restriction is dropped, the later time point is not baseline
        assertEquals(baselineSamples.stream().map(BaselineSample::getSampleId).collect(Collectors.toList()),
                Arrays.asList("s1", "s2", "s3", "s8"));

        BaselineSample s3 = baselineSamples.get(2);
        assertEquals(s3.getProject(), "prj2");
        assertEquals(s3.getSubjectId(), "sbj2");
        assertEquals(s3.getResponse(), "no");
        assertEquals(s3.getSex(), "F");
        assertEquals(s3.getTimeFromTreatmentStart(), 0);
        assertNull(baselineSamples.get(3).getResponse());
    }

    private static List<String> sampleIds(List<Sample> samples) {
        return samples.stream().map(Sample::getSampleId).collect(Collectors.toList());
    }
}
