package nl.systemsgenetics.cellpopulationanalyzer.store;

import com.google.common.collect.ImmutableList;
import nl.systemsgenetics.cellpopulationanalyzer.model.PopulationCount;
import nl.systemsgenetics.cellpopulationanalyzer.model.Sample;
import nl.systemsgenetics.cellpopulationanalyzer.model.Subject;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Store over records that are already held in memory. The records cannot change after construction,
 * so every instance is its own snapshot.
 */
public class InMemoryCellCountStore implements CellCountStore {

    private final ImmutableList<Subject> subjects;
    private final ImmutableList<Sample> samples;
    private final ImmutableList<PopulationCount> populationCounts;
    private final String snapshotIdentifier = "memory:" + UUID.randomUUID();

    public InMemoryCellCountStore(Collection<Subject> subjects,
                                  Collection<Sample> samples,
                                  Collection<PopulationCount> populationCounts) {
        this.subjects = ImmutableList.copyOf(subjects);
        this.samples = ImmutableList.copyOf(samples);
        this.populationCounts = ImmutableList.copyOf(populationCounts);
    }

    @Override
    public List<Subject> getSubjects() {
        return subjects;
    }

    @Override
    public List<Sample> getSamples() {
        return samples;
    }

    @Override
    public List<PopulationCount> getPopulationCounts() {
        return populationCounts;
    }

    @Override
    public String getSnapshotIdentifier() {
        return snapshotIdentifier;
    }
}
