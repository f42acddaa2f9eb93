package nl.systemsgenetics.cellpopulationanalyzer;

/**
 * Thrown when the population counts of a sample cannot be turned into frequencies:
 * the counts do not sum to a positive total, or a population is missing or duplicated.
 */
public class DataIntegrityException extends Exception {

    public DataIntegrityException(String message) {
        super(message);
    }
}
