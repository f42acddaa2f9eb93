package nl.systemsgenetics.cellpopulationanalyzer.store;

/**
 * Thrown when the store cannot be read. Reads are not retried.
 */
public class CellCountStoreException extends Exception {

    public CellCountStoreException(String message) {
        super(message);
    }

    public CellCountStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
