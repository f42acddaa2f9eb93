package nl.systemsgenetics.cellpopulationanalyzer.store;

import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.cellpopulationanalyzer.model.Subject;

import java.util.List;

/**
 * Read-only access to persisted subjects, samples and population counts.
 * Implementations never write to the underlying storage.
 */
public interface CellCountStore {

    List<Subject> getSubjects() throws CellCountStoreException;

    List<Sample> getSamples() throws CellCountStoreException;

    List<PopulationCount> getPopulationCounts() throws CellCountStoreException;

    /**
     * @return An identifier that changes whenever the stored records might have changed.
     * Results derived from this store can be reused as long as the identifier stays the same.
     */
    String getSnapshotIdentifier() throws CellCountStoreException;
}
