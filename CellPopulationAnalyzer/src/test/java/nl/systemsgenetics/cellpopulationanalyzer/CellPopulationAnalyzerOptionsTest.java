package nl.systemsgenetics.cellpopulationanalyzer;

import nl.systemsgenetics.cellpopulationanalyzer.model.CohortDefinition;
import org.apache.commons.cli.ParseException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;

import static org.testng.Assert.*;

public class CellPopulationAnalyzerOptionsTest {

    private File databaseFile;
    private String outputPrefix;

    @BeforeMethod
    public void setUp() throws IOException {
        databaseFile = File.createTempFile("cell-count", ".db");
        outputPrefix = new File(databaseFile.getParentFile(), "results").getPath();
    }

    @AfterMethod
    public void tearDown() {
        databaseFile.delete();
    }

    @Test
    public void testDefaults() throws ParseException {
        CellPopulationAnalyzerOptions options = new CellPopulationAnalyzerOptions(
                "-db", databaseFile.getPath(), "-o", outputPrefix);

        assertEquals(options.getDatabaseFile(), databaseFile);
        assertEquals(options.getOutputBasePath(), new File(outputPrefix));
        assertEquals(options.getLogFile(), new File(outputPrefix + ".log"));
        assertEquals(options.getAlpha(), 0.05, 0);
        assertFalse(options.isDebugMode());
        assertEquals(options.getCohort(), CohortDefinition.defaultResponderCohort());
    }

    @Test
    public void testCohortAndAlpha() throws ParseException {
        CellPopulationAnalyzerOptions options = new CellPopulationAnalyzerOptions(
                "--database", databaseFile.getPath(), "--output", outputPrefix,
                "--alpha", "0.1", "-c", "carcinoma", "-tr", "phauximab", "-st", "WB", "-d");

        assertEquals(options.getAlpha(), 0.1, 0);
        assertTrue(options.isDebugMode());
        assertEquals(options.getCohort(), CohortDefinition.responderCohort("carcinoma", "phauximab", "WB"));
    }

    @Test(expectedExceptions = ParseException.class)
    public void testMissingDatabaseOption() throws ParseException {
        new CellPopulationAnalyzerOptions("-o", outputPrefix);
    }

    @Test(expectedExceptions = ParseException.class, expectedExceptionsMessageRegExp = ".*does not exist.*")
    public void testNonExistingDatabase() throws ParseException {
        new CellPopulationAnalyzerOptions("-db", databaseFile.getPath() + ".missing", "-o", outputPrefix);
    }

    @Test(expectedExceptions = ParseException.class, expectedExceptionsMessageRegExp = ".*is a directory.*")
    public void testOutputDirectory() throws ParseException {
        new CellPopulationAnalyzerOptions("-db", databaseFile.getPath(), "-o", databaseFile.getParent());
    }

    @Test(expectedExceptions = ParseException.class, expectedExceptionsMessageRegExp = ".*not in \\(0, 1\\].*")
    public void testAlphaOutOfRange() throws ParseException {
        new CellPopulationAnalyzerOptions("-db", databaseFile.getPath(), "-o", outputPrefix, "-a", "1.5");
    }

    @Test(expectedExceptions = ParseException.class, expectedExceptionsMessageRegExp = ".*not a double.*")
    public void testAlphaNotANumber() throws ParseException {
        new CellPopulationAnalyzerOptions("-db", databaseFile.getPath(), "-o", outputPrefix, "-a", "five");
    }
}
