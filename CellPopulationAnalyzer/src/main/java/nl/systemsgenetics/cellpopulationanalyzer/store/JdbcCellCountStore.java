package nl.systemsgenetics.cellpopulationanalyzer.store;

import nl.systemsgenetics.cellpopulationanalyzer.model.CellPopulation;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.cellpopulationanalyzer.model.Subject;
import org.apache.log4j.Logger;
import org.sqlite.SQLiteConfig;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads subjects, samples and counts from a SQLite database with the tables
 * {@code subjects}, {@code samples} and {@code counts}.
 *
 * A read-only connection is opened for every read and closed before the read returns.
 */
public class JdbcCellCountStore implements CellCountStore {

    private static final Logger LOGGER = Logger.getLogger(JdbcCellCountStore.class);

    private static final String SUBJECTS_QUERY =
            "SELECT subject_id, condition, age, sex FROM subjects ORDER BY subject_id";
    private static final String SAMPLES_QUERY =
            "SELECT sample_id, project, subject_id, treatment, response, sample_type, time_from_treatment_start " +
                    "FROM samples ORDER BY sample_id";
    private static final String COUNTS_QUERY =
            "SELECT sample_id, population, count FROM counts ORDER BY sample_id, population";

    private final File databaseFile;

    public JdbcCellCountStore(File databaseFile) {
        this.databaseFile = databaseFile;
    }

    @Override
    public List<Subject> getSubjects() throws CellCountStoreException {
        List<Subject> subjects = new ArrayList<>();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(SUBJECTS_QUERY);
             ResultSet results = statement.executeQuery()) {
            while (results.next()) {
                subjects.add(new Subject(
                        results.getString("subject_id"),
                        results.getString("condition"),
                        results.getInt("age"),
                        results.getString("sex")));
            }
        } catch (SQLException e) {
            throw new CellCountStoreException(String.format(
                    "Could not read subjects from '%s': %s", databaseFile, e.getMessage()), e);
        }
        LOGGER.debug(String.format("Read %d subjects from '%s'", subjects.size(), databaseFile));
        return subjects;
    }

    @Override
    public List<Sample> getSamples() throws CellCountStoreException {
        List<Sample> samples = new ArrayList<>();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(SAMPLES_QUERY);
             ResultSet results = statement.executeQuery()) {
            while (results.next()) {
                samples.add(new Sample(
                        results.getString("sample_id"),
                        results.getString("project"),
                        results.getString("subject_id"),
                        results.getString("treatment"),
                        results.getString("response"),
                        results.getString("sample_type"),
                        results.getInt("time_from_treatment_start")));
            }
        } catch (SQLException e) {
            throw new CellCountStoreException(String.format(
                    "Could not read samples from '%s': %s", databaseFile, e.getMessage()), e);
        }
        LOGGER.debug(String.format("Read %d samples from '%s'", samples.size(), databaseFile));
        return samples;
    }

    @Override
    public List<PopulationCount> getPopulationCounts() throws CellCountStoreException {
        List<PopulationCount> populationCounts = new ArrayList<>();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(COUNTS_QUERY);
             ResultSet results = statement.executeQuery()) {
            while (results.next()) {
                String population = results.getString("population");
                try {
                    populationCounts.add(new PopulationCount(
                            results.getString("sample_id"),
                            CellPopulation.fromLabel(population),
                            results.getLong("count")));
                } catch (IllegalArgumentException e) {
                    throw new CellCountStoreException(String.format(
                            "Invalid count row in '%s': %s", databaseFile, e.getMessage()), e);
                }
            }
        } catch (SQLException e) {
            throw new CellCountStoreException(String.format(
                    "Could not read population counts from '%s': %s", databaseFile, e.getMessage()), e);
        }
        LOGGER.debug(String.format("Read %d population counts from '%s'", populationCounts.size(), databaseFile));
        return populationCounts;
    }

    /**
     * The snapshot is identified by the canonical path, size and modification time of the database file.
     */
    @Override
    public String getSnapshotIdentifier() throws CellCountStoreException {
        if (!databaseFile.isFile()) {
            throw new CellCountStoreException(String.format("Database '%s' does not exist", databaseFile));
        }
        try {
            return String.format("%s:%d:%d",
                    databaseFile.getCanonicalPath(), databaseFile.length(), databaseFile.lastModified());
        } catch (IOException e) {
            throw new CellCountStoreException(String.format(
                    "Could not resolve database path '%s'", databaseFile), e);
        }
    }

    public File getDatabaseFile() {
        return databaseFile;
    }

    private Connection openConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return config.createConnection("jdbc:sqlite:" + databaseFile.getPath());
    }
}
