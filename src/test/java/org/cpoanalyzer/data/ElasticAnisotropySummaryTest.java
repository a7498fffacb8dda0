package org.cpoanalyzer.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ElasticAnisotropySummaryTest {

    private static ElasticDecomposition decomposition() {
        Map<SymmetryClass, double[]> partials = new EnumMap<>(SymmetryClass.class);
        partials.put(SymmetryClass.HEXAGONAL, new double[] {4.0, 2.0, 1.0});
        partials.put(SymmetryClass.TETRAGONAL, new double[] {2.0, 1.0, 0.5});
        partials.put(SymmetryClass.ORTHORHOMBIC, new double[] {2.0, 1.0, 0.0});
        partials.put(SymmetryClass.MONOCLINIC, new double[] {1.0, 0.5, 0.0});
        partials.put(SymmetryClass.TRICLINIC, new double[] {1.0, 0.0, 0.0});
        return new ElasticDecomposition(100.0, OptionalDouble.of(90.0), partials);
    }

    @Test
    void totalAnisotropy_sumsFirstComponents() {
        ElasticAnisotropySummary summary = new ElasticAnisotropySummary(decomposition());

        assertThat(summary.totalAnisotropy()).isEqualTo(10.0);
        assertThat(summary.anisotropicPercent()).isCloseTo(10.0, within(1e-12));
    }

    @Test
    void percentages_useFullNormAndTotalAnisotropy() {
        ElasticAnisotropySummary summary = new ElasticAnisotropySummary(decomposition());

        assertThat(summary.percentOfFull(SymmetryClass.HEXAGONAL, 0)).isCloseTo(4.0, within(1e-12));
        assertThat(summary.percentOfFull(SymmetryClass.TETRAGONAL, 2)).isCloseTo(0.5, within(1e-12));
        assertThat(summary.percentOfAnisotropy(SymmetryClass.HEXAGONAL, 0)).isCloseTo(40.0, within(1e-12));
        assertThat(summary.percentOfAnisotropy(SymmetryClass.MONOCLINIC, 1)).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void firstComponentShares_addUpToHundredPercent() {
        ElasticAnisotropySummary summary = new ElasticAnisotropySummary(decomposition());

        double total = 0.0;
        for (SymmetryClass symmetry : SymmetryClass.values()) {
            total += summary.percentOfAnisotropy(symmetry, 0);
        }
        assertThat(total).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void decomposition_requiresThreeComponentsPerFamily() {
        Map<SymmetryClass, double[]> partials = new EnumMap<>(SymmetryClass.class);
        partials.put(SymmetryClass.HEXAGONAL, new double[] {1.0, 2.0});

        assertThatThrownBy(() -> new ElasticDecomposition(1.0, OptionalDouble.empty(), partials))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
