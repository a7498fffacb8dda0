package org.cpoanalyzer.data;

/**
 * Percentages derived from an {@link ElasticDecomposition} for the plot header.
 * <p>
 * The total anisotropy is the sum of the first principal component of every symmetry
 * family. Each component is reported relative to the full norm and relative to the
 * total anisotropy.
 */
public final class ElasticAnisotropySummary {

    private final ElasticDecomposition decomposition;
    private final double totalAnisotropy;

    public ElasticAnisotropySummary(ElasticDecomposition decomposition) {
        this.decomposition = decomposition;
        double total = 0.0;
        for (SymmetryClass symmetry : SymmetryClass.values()) {
            total += decomposition.partial(symmetry, 0);
        }
        this.totalAnisotropy = total;
    }

    public double totalAnisotropy() {
        return totalAnisotropy;
    }

    /** Total anisotropy as a percentage of the full norm. */
    public double anisotropicPercent() {
        return totalAnisotropy / decomposition.fullNormSquare() * 100.0;
    }

    /**
     * @param symmetry  the family.
     * @param component 0-based component.
     * @return the component as a percentage of the full norm.
     */
    public double percentOfFull(SymmetryClass symmetry, int component) {
        return decomposition.partial(symmetry, component) / decomposition.fullNormSquare() * 100.0;
    }

    /**
     * @param symmetry  the family.
     * @param component 0-based component.
     * @return the component as a percentage of the total anisotropy.
     */
    public double percentOfAnisotropy(SymmetryClass symmetry, int component) {
        return decomposition.partial(symmetry, component) / totalAnisotropy * 100.0;
    }
}
