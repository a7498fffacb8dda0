package org.cpoanalyzer.cli.rendering;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import org.cpoanalyzer.data.ElasticDecomposition;
import org.cpoanalyzer.data.ParticleRecord;
import org.cpoanalyzer.data.SymmetryClass;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ElasticityHeaderTest {

    private static ParticleRecord withDecomposition() {
        Map<SymmetryClass, double[]> partials = new EnumMap<>(SymmetryClass.class);
        for (SymmetryClass symmetry : SymmetryClass.values()) {
            partials.put(symmetry, new double[] {1.0, 0.5, 0.25});
        }
        partials.put(SymmetryClass.HEXAGONAL, new double[] {6.0, 2.0, 1.0});
        ElasticDecomposition elastic = new ElasticDecomposition(100.0, OptionalDouble.of(90.0), partials);
        return new ParticleRecord(7, 1.0, 2.0, OptionalDouble.of(3.0), OptionalDouble.of(2.0), Optional.of(elastic));
    }

    @Test
    void summaryLine_withDecomposition() {
        String line = ElasticityHeader.summaryLine(withDecomposition(), 2.5e5, 12);

        assertThat(line)
                .startsWith("id=7, time=2.50000e+05")
                .contains("position=(1.000e+00:2.000e+00:3.000e+00)")
                .contains("ODT=2.0000")
                .contains("grains=12")
                .endsWith("anisotropic%=10.0000");
    }

    @Test
    void summaryLine_withoutDecompositionShowsBasicsOnly() {
        String line = ElasticityHeader.summaryLine(ParticleRecord.zeroed(3), 1.0, 4);

        assertThat(line).contains("id=3").contains("grains=4").doesNotContain("anisotropic").doesNotContain("ODT");
        assertThat(ElasticityHeader.symmetryColumns(ParticleRecord.zeroed(3))).isEmpty();
    }

    @Test
    void symmetryColumns_onePerFamily() {
        List<String[]> columns = ElasticityHeader.symmetryColumns(withDecomposition());

        assertThat(columns).hasSize(5);
        assertThat(columns.get(0)).containsExactly("hex%=6.00,2.00,1.00", "h/a%=60.00,20.00,10.00");
        assertThat(columns.get(4)[0]).startsWith("tri%=");
    }
}
