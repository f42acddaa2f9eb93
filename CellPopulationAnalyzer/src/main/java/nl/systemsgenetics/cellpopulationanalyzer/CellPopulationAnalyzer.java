package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.cellpopulationanalyzer.model.Subject;
import nl.systemsgenetics.cellpopulationanalyzer.store.CellCountStore;
import nl.systemsgenetics.cellpopulationanalyzer.store.CellCountStoreException;
import nl.systemsgenetics.cellpopulationanalyzer.store.JdbcCellCountStore;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.tuple.ImmutableTriple;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.SimpleLayout;

import java.io.IOException;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.*;

/**
 * Derives population frequencies, a responder versus non-responder comparison and a baseline
 * breakdown for a cohort from the records in a cell count store.
 *
 * Results are memoized per cohort, significance threshold and store snapshot, so that repeated
 * requests for an unchanged store are not recomputed.
 */
public class CellPopulationAnalyzer {

    private static final String VERSION = ResourceBundle.getBundle("version").getString("application.version");
    private static final DateFormat DATE_TIME_FORMAT = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss");
    private static final Logger LOGGER = Logger.getLogger(CellPopulationAnalyzer.class);
    private static final String HEADER
            = "  /---------------------------------------\\\n"
            + "  |        CellPopulationAnalyzer         |\n"
            + "  |   Immune cell population frequencies  |\n"
            + "  \\---------------------------------------/";

    private final CellCountStore store;
    private final Map<ImmutableTriple<CohortDefinition, Double, String>, AnalysisResults> results = new HashMap<>();

    /**
     * @param store The store to read subjects, samples and counts from.
     */
    public CellPopulationAnalyzer(CellCountStore store) {
        this.store = store;
    }

    /**
     * Analyzes a cohort, reusing an earlier result if the store snapshot has not changed since.
     *
     * @param cohort The cohort to compare responders and non-responders in.
     *               Its baseline samples are used for the baseline breakdown.
     * @param alpha Threshold below which adjusted p-values are significant.
     * @return The summary, comparison, statistics and baseline outputs.
     * @throws CellPopulationAnalyzerException if the store could not be read or its counts are inconsistent.
     */
    public AnalysisResults analyze(CohortDefinition cohort, double alpha) throws CellPopulationAnalyzerException {
        ImmutableTriple<CohortDefinition, Double, String> key;
        try {
            key = ImmutableTriple.of(cohort, alpha, store.getSnapshotIdentifier());
        } catch (CellCountStoreException e) {
            throw new CellPopulationAnalyzerException("Could not identify the store snapshot: " + e.getMessage(), e);
        }

        AnalysisResults cachedResults = results.get(key);
        if (cachedResults != null) {
            LOGGER.debug("Reusing results for snapshot " + key.getRight());
            return cachedResults;
        }

        AnalysisResults analysisResults = calculate(cohort, alpha);
        results.put(key, analysisResults);
        return analysisResults;
    }

    private AnalysisResults calculate(CohortDefinition cohort, double alpha) throws CellPopulationAnalyzerException {
        List<Subject> subjects;
        List<Sample> samples;
        List<PopulationCount> populationCounts;
        try {
            subjects = store.getSubjects();
            samples = store.getSamples();
            populationCounts = store.getPopulationCounts();
        } catch (CellCountStoreException e) {
            throw new CellPopulationAnalyzerException("Could not read the cell count store: " + e.getMessage(), e);
        }
        LOGGER.info(String.format("Loaded %d subjects, %d samples and %d population counts",
                subjects.size(), samples.size(), populationCounts.size()));

        try {
            List<SampleFrequency> summary = new FrequencyAggregator().summarize(populationCounts);
            LOGGER.info(String.format("Calculated %d population frequencies", summary.size()));

            CohortSelector cohortSelector = new CohortSelector(subjects, samples, populationCounts);

            List<CohortFrequency> comparison = cohortSelector.selectFrequencies(cohort);
            if (comparison.isEmpty()) {
                LOGGER.warn("No samples found for cohort: " + cohort);
            } else {
                LOGGER.info(String.format("Selected %d cohort frequencies", comparison.size()));
            }

            List<PopulationComparison> statistics = new ResponderComparison(alpha).compare(comparison);
            for (PopulationComparison populationComparison : statistics) {
                LOGGER.info(populationComparison);
            }

            List<BaselineSample> baselineSamples = cohortSelector.selectBaselineSamples(cohort);
            LOGGER.info(String.format("Selected %d baseline samples", baselineSamples.size()));
            BaselineBreakdown baselineBreakdown = new BaselineSummarizer().summarize(baselineSamples);

            return new AnalysisResults(cohort, summary, comparison, statistics, baselineSamples, baselineBreakdown);

        } catch (DataIntegrityException e) {
            throw new CellPopulationAnalyzerException("Inconsistent population counts: " + e.getMessage(), e);
        }
    }

    public static void main(String[] args) throws InterruptedException {

        // Get the current date and time.
        String startDateTime = DATE_TIME_FORMAT.format(new Date());

        // Print a header
        System.out.printf("%s%n%n" +
                        "Version: %s%n%n" +
                        "Current date and time: %s%n",
                HEADER, VERSION, startDateTime);

        System.out.flush(); //flush to make sure header is before errors
        Thread.sleep(25); //Allows flush to complete

        // Parse the arguments list
        CellPopulationAnalyzerOptions options = getCellPopulationAnalyzerOptions(args);

        // Create a logger (set the correct file for output)
        createLogger(startDateTime, options);

        // Print the options
        options.printOptions();

        CellPopulationAnalyzer cellPopulationAnalyzer = new CellPopulationAnalyzer(
                new JdbcCellCountStore(options.getDatabaseFile()));

        try {
            AnalysisResults analysisResults = cellPopulationAnalyzer.analyze(options.getCohort(), options.getAlpha());

            new AnalysisResultsWriter(options.getOutputBasePath()).save(analysisResults);
            LOGGER.info("Results written to " + options.getOutputBasePath().getAbsolutePath() + "_*.tsv");

        } catch (CellPopulationAnalyzerException e) {
            System.err.println("Error running CellPopulationAnalyzer: " + e.getMessage());
            System.err.println("See log file for stack trace");
            LOGGER.fatal("Error running CellPopulationAnalyzer: " + e.getMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Error saving output from CellPopulationAnalyzer: " + e.getMessage());
            System.err.println("See log file for stack trace");
            LOGGER.fatal("Error saving output from CellPopulationAnalyzer: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private static CellPopulationAnalyzerOptions getCellPopulationAnalyzerOptions(String[] args) {
        CellPopulationAnalyzerOptions options = null;
        if (args.length == 0) {
            CellPopulationAnalyzerOptions.printHelp();
            System.exit(1);
        }

        try {
            options = new CellPopulationAnalyzerOptions(args);
        } catch (ParseException ex) {
            System.err.println("Error parsing commandline: " + ex.getMessage());
            CellPopulationAnalyzerOptions.printHelp();
            System.exit(1);
        }
        return options;
    }

    private static void createLogger(String startDateTime, CellPopulationAnalyzerOptions options) {
        if (options.getLogFile().getParentFile() != null && !options.getLogFile().getParentFile().isDirectory()) {
            if (!options.getLogFile().getParentFile().mkdirs()) {
                System.err.println("Failed to create output folder: " + options.getLogFile().getParent());
                System.exit(1);
            }
        }

        try {
            // Apply a new log file.
            FileAppender logFileAppender = new FileAppender(new SimpleLayout(), options.getLogFile().getCanonicalPath());
            Logger.getRootLogger().addAppender(logFileAppender);

            // Log some first info.
            LOGGER.info("CellPopulationAnalyzer " + VERSION);
            LOGGER.info("Current date and time: " + startDateTime);

            if (options.isDebugMode()) {
                Logger.getRootLogger().setLevel(Level.DEBUG);
            } else {
                Logger.getRootLogger().setLevel(Level.INFO);
            }

        } catch (IOException e) {
            System.err.println("Failed to create logger: " + e.getMessage());
            System.exit(1);
        }
    }
}
