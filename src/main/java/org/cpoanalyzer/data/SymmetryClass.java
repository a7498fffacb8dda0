package org.cpoanalyzer.data;

/**
 * Symmetry families of the elastic tensor decomposition, in the order they appear in the
 * plot header. Column names follow the simulation output, including its spelling of
 * {@code orthohombic}.
 */
public enum SymmetryClass {
    HEXAGONAL("hexagonal", "hex", "h"),
    TETRAGONAL("tetragonal", "tet", "t"),
    ORTHORHOMBIC("orthohombic", "ort", "o"),
    MONOCLINIC("monoclinic", "mon", "m"),
    TRICLINIC("triclinic", "tri", "t");

    /** Number of principal components recorded per family. */
    public static final int COMPONENTS = 3;

    private final String columnPrefix;
    private final String shortName;
    private final String initial;

    SymmetryClass(String columnPrefix, String shortName, String initial) {
        this.columnPrefix = columnPrefix;
        this.shortName = shortName;
        this.initial = initial;
    }

    /**
     * Column holding one principal component, e.g. {@code hexagonal_norm_square_p1}.
     *
     * @param component 1-based component index.
     */
    public String column(int component) {
        return columnPrefix + "_norm_square_p" + component;
    }

    public String shortName() {
        return shortName;
    }

    public String initial() {
        return initial;
    }
}
