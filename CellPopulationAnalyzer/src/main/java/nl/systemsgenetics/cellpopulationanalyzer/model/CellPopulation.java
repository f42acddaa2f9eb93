package nl.systemsgenetics.cellpopulationanalyzer.model;

/**
 * The fixed set of immune cell populations that are counted for every sample.
 * The declaration order is the order in which per-population statistics are reported.
 */
public enum CellPopulation {
    B_CELL("b_cell"),
    CD8_T_CELL("cd8_t_cell"),
    CD4_T_CELL("cd4_t_cell"),
    NK_CELL("nk_cell"),
    MONOCYTE("monocyte");

    private final String label;

    CellPopulation(String label) {
        this.label = label;
    }

    /**
     * @return The identifier of this population as stored in the counts table.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Looks up a population by the identifier used in the counts table.
     *
     * @param label The stored population identifier.
     * @return The matching population.
     * @throws IllegalArgumentException if the label does not name one of the fixed populations.
     */
    public static CellPopulation fromLabel(String label) {
        for (CellPopulation population : values()) {
            if (population.label.equals(label)) {
                return population;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown cell population: '%s'", label));
    }

    @Override
    public String toString() {
        return label;
    }
}
