package org.cpoanalyzer.data;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Norm-squared decomposition of a particle's elastic tensor into symmetry families.
 *
 * @param fullNormSquare      norm squared of the full tensor.
 * @param isotropicNormSquare isotropic part, when recorded.
 * @param partialNorms        three principal components per symmetry family.
 */
public record ElasticDecomposition(double fullNormSquare, OptionalDouble isotropicNormSquare,
                                   Map<SymmetryClass, double[]> partialNorms) {

    public ElasticDecomposition {
        Map<SymmetryClass, double[]> copy = new EnumMap<>(SymmetryClass.class);
        for (SymmetryClass symmetry : SymmetryClass.values()) {
            double[] values = partialNorms.get(symmetry);
            if (values == null || values.length != SymmetryClass.COMPONENTS) {
                throw new IllegalArgumentException("Expected " + SymmetryClass.COMPONENTS
                        + " components for " + symmetry + " symmetry");
            }
            copy.put(symmetry, values.clone());
        }
        partialNorms = copy;
    }

    /**
     * @param symmetry  the family.
     * @param component 0-based component.
     */
    public double partial(SymmetryClass symmetry, int component) {
        return partialNorms.get(symmetry)[component];
    }
}
