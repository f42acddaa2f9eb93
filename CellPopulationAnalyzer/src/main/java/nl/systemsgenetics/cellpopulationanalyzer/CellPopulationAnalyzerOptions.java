package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;
import nl.systemsgenetics.stats.BenjaminiHochbergCorrector;
import org.apache.commons.cli.*;
import org.apache.log4j.Logger;

import java.io.File;

/**
 * Command line options of the cell population analyzer.
 */
public class CellPopulationAnalyzerOptions {

    private static final Options OPTIONS;
    private static final Logger LOGGER = Logger.getLogger(CellPopulationAnalyzerOptions.class);

    private final boolean debugMode;
    private final double alpha;
    private final File databaseFile;
    private final File outputBasePath;
    private final File logFile;
    private final CohortDefinition cohort;

    static {

        OPTIONS = new Options();

        OptionBuilder.withArgName("path");
        OptionBuilder.hasArg();
        OptionBuilder.withDescription("SQLite database with the subjects, samples and counts tables");
        OptionBuilder.withLongOpt("database");
        OptionBuilder.isRequired();
        OPTIONS.addOption(OptionBuilder.create("db"));

        OptionBuilder.withArgName("path");
        OptionBuilder.hasArg();
        OptionBuilder.withDescription("The output path prefix");
        OptionBuilder.withLongOpt("output");
        OptionBuilder.isRequired();
        OPTIONS.addOption(OptionBuilder.create("o"));

        OptionBuilder.withArgName("double");
        OptionBuilder.hasArg();
        OptionBuilder.withDescription("Significance threshold for the adjusted p-values. Defaults to "
                + BenjaminiHochbergCorrector.DEFAULT_ALPHA);
        OptionBuilder.withLongOpt("alpha");
        OPTIONS.addOption(OptionBuilder.create("a"));

        OptionBuilder.withArgName("string");
        OptionBuilder.hasArg();
        OptionBuilder.withDescription("Condition of the subjects in the cohort. Defaults to "
                + CohortDefinition.DEFAULT_CONDITION);
        OptionBuilder.withLongOpt("condition");
        OPTIONS.addOption(OptionBuilder.create("c"));

        OptionBuilder.withArgName("string");
        OptionBuilder.hasArg();
        OptionBuilder.withDescription("Treatment of the samples in the cohort. Defaults to "
                + CohortDefinition.DEFAULT_TREATMENT);
        OptionBuilder.withLongOpt("treatment");
        OPTIONS.addOption(OptionBuilder.create("tr"));

        OptionBuilder.withArgName("string");
        OptionBuilder.hasArg();
        OptionBuilder.withDescription("Sample type of the samples in the cohort. Defaults to "
                + CohortDefinition.DEFAULT_SAMPLE_TYPE);
        OptionBuilder.withLongOpt("sampleType");
        OPTIONS.addOption(OptionBuilder.create("st"));

        OptionBuilder.withArgName("boolean");
        OptionBuilder.withDescription("Activate debug mode. This will result in a more verbose log file.");
        OptionBuilder.withLongOpt("debug");
        OPTIONS.addOption(OptionBuilder.create("d"));
    }

    public CellPopulationAnalyzerOptions(String... args) throws ParseException {

        // Parse the raw command line input
        final CommandLineParser parser = new PosixParser();
        final CommandLine commandLine = parser.parse(OPTIONS, args, false);

        outputBasePath = getOutputBasePath(commandLine);
        logFile = new File(outputBasePath + ".log");
        debugMode = commandLine.hasOption('d');
        databaseFile = parseDatabaseFile(commandLine);
        alpha = parseAlpha(commandLine);
        cohort = CohortDefinition.responderCohort(
                commandLine.getOptionValue("condition", CohortDefinition.DEFAULT_CONDITION),
                commandLine.getOptionValue("treatment", CohortDefinition.DEFAULT_TREATMENT),
                commandLine.getOptionValue("sampleType", CohortDefinition.DEFAULT_SAMPLE_TYPE));
    }

    /**
     * Parses the significance threshold from the command line.
     *
     * @param commandLine the command line that could contain the threshold in option "alpha".
     * @return the provided threshold or the default of 0.05.
     * @throws ParseException if the value is not a double in (0, 1].
     */
    private double parseAlpha(CommandLine commandLine) throws ParseException {
        if (!commandLine.hasOption("alpha")) {
            return BenjaminiHochbergCorrector.DEFAULT_ALPHA;
        }

        double parsedAlpha;
        try {
            parsedAlpha = Double.parseDouble(commandLine.getOptionValue("alpha"));
        } catch (NumberFormatException e) {
            throw new ParseException(String.format(
                    "Error parsing -a / --alpha: \"%s\" is not a double", commandLine.getOptionValue("alpha")));
        }
        if (!(parsedAlpha > 0 && parsedAlpha <= 1)) {
            throw new ParseException(String.format(
                    "Error parsing -a / --alpha: \"%s\" is not in (0, 1]", commandLine.getOptionValue("alpha")));
        }
        return parsedAlpha;
    }

    private File parseDatabaseFile(CommandLine commandLine) throws ParseException {
        File database = new File(commandLine.getOptionValue("database"));
        if (!database.isFile()) {
            throw new ParseException(String.format("Database file \"%s\" does not exist",
                    commandLine.getOptionValue("database")));
        }
        return database;
    }

    /**
     * Method that gets the output base path from the command line.
     *
     * @param commandLine The command line that contains the output base path in '-o'
     * @return the output base path as a file.
     * @throws ParseException if the provided path points to an existing directory.
     */
    private File getOutputBasePath(CommandLine commandLine) throws ParseException {
        File outputBasePath = new File(commandLine.getOptionValue('o'));
        if (outputBasePath.isDirectory()) {
            throw new ParseException(String.format("Specified output path '%s' is a directory. " +
                            "Please include a prefix for the output files.",
                    outputBasePath.toString()));
        }
        return outputBasePath;
    }

    public static void printHelp() {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(" ", OPTIONS);
    }

    public void printOptions() {

        LOGGER.info("Supplied options:");

        LOGGER.info(" * Database: " + databaseFile.getAbsolutePath());

        LOGGER.info(" * Output path: " + outputBasePath.getAbsolutePath());

        LOGGER.info(" * Cohort: " + cohort);

        LOGGER.info(" * Significance threshold: " + alpha);

        LOGGER.info(" * Debug mode: " + (debugMode ? "on" : "off"));

    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public double getAlpha() {
        return alpha;
    }

    public File getDatabaseFile() {
        return databaseFile;
    }

    public File getOutputBasePath() {
        return outputBasePath;
    }

    public File getLogFile() {
        return logFile;
    }

    public CohortDefinition getCohort() {
        return cohort;
    }
}
