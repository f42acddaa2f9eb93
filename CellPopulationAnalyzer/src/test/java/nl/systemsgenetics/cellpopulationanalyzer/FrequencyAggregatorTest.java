package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import org.testng.annotations.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.testng.Assert.*;

public class FrequencyAggregatorTest {

    private final FrequencyAggregator frequencyAggregator = new FrequencyAggregator();

    @Test
    public void testSummarizeToyDataset() throws DataIntegrityException {
        List<PopulationCount> shuffledCounts = new ArrayList<>(ToyDataset.populationCounts());
        Collections.shuffle(shuffledCounts, new Random(7));

        List<SampleFrequency> summary = frequencyAggregator.summarize(shuffledCounts);

        assertEquals(summary.size(), 15);

        // Ordered by sample, then by the stored population identifier
        assertEquals(summary.stream().map(SampleFrequency::getSampleId).collect(Collectors.toList()),
                Arrays.asList("s1", "s1", "s1", "s1", "s1", "s2", "s2", "s2", "s2", "s2",
                        "s3", "s3", "s3", "s3", "s3"));
        assertEquals(summary.subList(0, 5).stream().map(SampleFrequency::getPopulation).collect(Collectors.toList()),
                Arrays.asList(CellPopulation.B_CELL, CellPopulation.CD4_T_CELL, CellPopulation.CD8_T_CELL,
                        CellPopulation.MONOCYTE, CellPopulation.NK_CELL));

        assertEquals(percentages(summary, "s1"), new double[]{10.0, 30.0, 20.0, 25.0, 15.0}, 1e-12);
        assertEquals(percentages(summary, "s2"), new double[]{33.333, 33.333, 33.333, 0.0, 0.0}, 1e-12);
        assertEquals(percentages(summary, "s3"), new double[]{50.0, 25.0, 25.0, 0.0, 0.0}, 1e-12);

        assertEquals(summary.get(0).getTotalCount(), 1000);
        assertEquals(summary.get(0).getCount(), 100);
        assertEquals(summary.get(5).getTotalCount(), 3);
        assertEquals(summary.get(10).getTotalCount(), 100);
    }

    @Test
    public void testPercentagesSumToHundred() throws DataIntegrityException {
        Random random = new Random(42);
        List<PopulationCount> counts = new ArrayList<>();
        for (int sample = 0; sample < 100; sample++) {
            counts.addAll(ToyDataset.counts(String.format("sample%03d", sample),
                    random.nextInt(5000), random.nextInt(5000), random.nextInt(5000),
                    random.nextInt(5000), 1 + random.nextInt(5000)));
        }

        Map<String, Double> sums = new HashMap<>();
        for (SampleFrequency frequency : frequencyAggregator.summarize(counts)) {
            sums.merge(frequency.getSampleId(), frequency.getPercentage(), Double::sum);
        }

        assertEquals(sums.size(), 100);
        for (double sum : sums.values()) {
            assertEquals(sum, 100.0, 0.01);
        }
    }

    @Test
    public void testSummarizeEmpty() throws DataIntegrityException {
        assertTrue(frequencyAggregator.summarize(Collections.emptyList()).isEmpty());
    }

    @Test(expectedExceptions = DataIntegrityException.class,
            expectedExceptionsMessageRegExp = ".*'empty'.*total cell count of 0.*")
    public void testZeroTotal() throws DataIntegrityException {
        List<PopulationCount> counts = new ArrayList<>(ToyDataset.populationCounts());
        counts.addAll(ToyDataset.counts("empty", 0, 0, 0, 0, 0));

        frequencyAggregator.summarize(counts);
    }

    @Test(expectedExceptions = DataIntegrityException.class,
            expectedExceptionsMessageRegExp = ".*'partial'.*missing.*monocyte.*")
    public void testMissingPopulation() throws DataIntegrityException {
        frequencyAggregator.summarize(ToyDataset.counts("partial", 10, 10, 10, 10));
    }

    @Test(expectedExceptions = DataIntegrityException.class)
    public void testDuplicatePopulation() throws DataIntegrityException {
        List<PopulationCount> counts = new ArrayList<>(ToyDataset.counts("s1", 1, 2, 3, 4, 5));
        counts.add(new PopulationCount("s1", CellPopulation.NK_CELL, 4));

        frequencyAggregator.summarize(counts);
    }

    private static double[] percentages(List<SampleFrequency> summary, String sampleId) {
        return summary.stream()
                .filter(frequency -> frequency.getSampleId().equals(sampleId))
                .mapToDouble(SampleFrequency::getPercentage)
                .toArray();
    }
}
