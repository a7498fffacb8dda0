package org.cpoanalyzer.polefigure;

/**
 * Mineral phases recorded per grain. The ordinal is the mineral index in the grain shard
 * columns ({@code mineral_0_EA_*} for olivine, {@code mineral_1_EA_*} for enstatite).
 */
public enum Mineral {
    OLIVINE("Olivine", "oli", "olivine"),
    ENSTATITE("Enstatite", "ens", "enstatite");

    private final String configName;
    private final String fileTag;
    private final String label;

    Mineral(String configName, String fileTag, String label) {
        this.configName = configName;
        this.fileTag = fileTag;
        this.label = label;
    }

    /**
     * Parses the name used in configuration files ({@code Olivine}, {@code Enstatite}).
     *
     * @param name configured name.
     * @return the mineral.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static Mineral fromConfigName(String name) {
        for (Mineral mineral : values()) {
            if (mineral.configName.equals(name)) {
                return mineral;
            }
        }
        throw new IllegalArgumentException("Unknown mineral '" + name + "', expected Olivine or Enstatite");
    }

    public int columnIndex() {
        return ordinal();
    }

    public String configName() {
        return configName;
    }

    public String fileTag() {
        return fileTag;
    }

    public String label() {
        return label;
    }
}
