package org.cpoanalyzer.polefigure;

/**
 * Crystal axis shown in a pole figure. The ordinal matches the row of the grain's
 * rotation matrix that holds the axis vector.
 */
public enum CrystalAxis {
    A_AXIS("AAxis", "A", "a-axis"),
    B_AXIS("BAxis", "B", "b-axis"),
    C_AXIS("CAxis", "C", "c-axis");

    private final String configName;
    private final String fileTag;
    private final String label;

    CrystalAxis(String configName, String fileTag, String label) {
        this.configName = configName;
        this.fileTag = fileTag;
        this.label = label;
    }

    /**
     * Parses the name used in configuration files ({@code AAxis}, {@code BAxis}, {@code CAxis}).
     *
     * @param name configured name.
     * @return the axis.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static CrystalAxis fromConfigName(String name) {
        for (CrystalAxis axis : values()) {
            if (axis.configName.equals(name)) {
                return axis;
            }
        }
        throw new IllegalArgumentException("Unknown crystal axis '" + name + "', expected AAxis, BAxis or CAxis");
    }

    public int matrixRow() {
        return ordinal();
    }

    public String configName() {
        return configName;
    }

    /** Single-letter tag used in output file names. */
    public String fileTag() {
        return fileTag;
    }

    /** Label drawn on the figure. */
    public String label() {
        return label;
    }
}
