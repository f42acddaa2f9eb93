package nl.systemsgenetics.cellpopulationanalyzer;

public class CellPopulationAnalyzerException extends Exception {

    public CellPopulationAnalyzerException(String message) {
        super(message);
    }

    public CellPopulationAnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }
}
