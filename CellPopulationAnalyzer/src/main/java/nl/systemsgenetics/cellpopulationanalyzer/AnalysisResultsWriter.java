package nl.systemsgenetics.cellpopulationanalyzer;

import com.opencsv.CSVWriter;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.Map;

/**
 * Writes the outputs of an analysis as tab separated tables sharing an output prefix.
 */
public class AnalysisResultsWriter {

    private static final char SEPARATOR = '\t';

    private final File outputBasePath;

    public AnalysisResultsWriter(File outputBasePath) {
        this.outputBasePath = outputBasePath;
    }

    public void save(AnalysisResults results) throws IOException {
        saveSummary(results);
        saveComparison(results);
        saveStatistics(results);
        saveBaseline(results);
    }

    private void saveSummary(AnalysisResults results) throws IOException {
        try (CSVWriter writer = createWriter("summary")) {
            writer.writeNext(new String[]{"sample", "total_count", "population", "count", "percentage"});
            for (SampleFrequency frequency : results.getSummary()) {
                writer.writeNext(new String[]{
                        frequency.getSampleId(),
                        String.valueOf(frequency.getTotalCount()),
                        frequency.getPopulation().getLabel(),
                        String.valueOf(frequency.getCount()),
                        String.valueOf(frequency.getPercentage())});
            }
        }
    }

    private void saveComparison(AnalysisResults results) throws IOException {
        try (CSVWriter writer = createWriter("comparison")) {
            writer.writeNext(new String[]{"sample", "response", "population", "count", "percentage"});
            for (CohortFrequency frequency : results.getComparison()) {
                writer.writeNext(new String[]{
                        frequency.getSampleId(),
                        frequency.getResponse(),
                        frequency.getPopulation().getLabel(),
                        String.valueOf(frequency.getCount()),
                        String.valueOf(frequency.getPercentage())});
            }
        }
    }

    private void saveStatistics(AnalysisResults results) throws IOException {
        try (CSVWriter writer = createWriter("stats")) {
            writer.writeNext(new String[]{"population", "n_yes", "n_no", "p_value", "p_value_adj", "significant"});
            for (PopulationComparison comparison : results.getStatistics()) {
                writer.writeNext(new String[]{
                        comparison.getPopulation().getLabel(),
                        String.valueOf(comparison.getResponderCount()),
                        String.valueOf(comparison.getNonResponderCount()),
                        formatPValue(comparison.getPValue()),
                        formatPValue(comparison.getAdjustedPValue()),
                        String.valueOf(comparison.isSignificant())});
            }
        }
    }

    private void saveBaseline(AnalysisResults results) throws IOException {
        try (CSVWriter writer = createWriter("baseline")) {
            writer.writeNext(new String[]{
                    "sample_id", "project", "subject_id", "response", "sex", "time_from_treatment_start"});
            for (BaselineSample baselineSample : results.getBaselineSamples()) {
                writer.writeNext(new String[]{
                        baselineSample.getSampleId(),
                        baselineSample.getProject(),
                        baselineSample.getSubjectId(),
                        baselineSample.getResponse(),
                        baselineSample.getSex(),
                        String.valueOf(baselineSample.getTimeFromTreatmentStart())});
            }
        }

        BaselineBreakdown breakdown = results.getBaselineBreakdown();
        saveGroupedCounts("baselineSamplesPerProject", "project", "sample_count",
                breakdown.getSamplesPerProject());
        saveGroupedCounts("baselineSubjectsByResponse", "response", "subject_count",
                breakdown.getSubjectsByResponse());
        saveGroupedCounts("baselineSubjectsBySex", "sex", "subject_count",
                breakdown.getSubjectsBySex());
    }

    private void saveGroupedCounts(String suffix, String groupColumn, String countColumn,
                                   Map<String, Integer> counts) throws IOException {
        try (CSVWriter writer = createWriter(suffix)) {
            writer.writeNext(new String[]{groupColumn, countColumn});
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                writer.writeNext(new String[]{entry.getKey(), String.valueOf(entry.getValue())});
            }
        }
    }

    File getOutputFile(String suffix) {
        return new File(String.format("%s_%s.tsv", outputBasePath, suffix));
    }

    private CSVWriter createWriter(String suffix) throws IOException {
        return new CSVWriter(new FileWriter(getOutputFile(suffix)),
                SEPARATOR, CSVWriter.NO_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END);
    }

    private static String formatPValue(double pValue) {
        return Double.isNaN(pValue) ? "NA" : String.valueOf(pValue);
    }
}
