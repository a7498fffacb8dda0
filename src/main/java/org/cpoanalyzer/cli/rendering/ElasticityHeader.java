package org.cpoanalyzer.cli.rendering;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.cpoanalyzer.data.ElasticAnisotropySummary;
import org.cpoanalyzer.data.ParticleRecord;
import org.cpoanalyzer.data.SymmetryClass;

/**
 * Text of the plot header: a particle summary line followed, when the particle carries an
 * elastic decomposition, by one column per symmetry family with its share of the full norm
 * and of the total anisotropy.
 */
final class ElasticityHeader {

    private ElasticityHeader() {
    }

    static String summaryLine(ParticleRecord particle, double time, int grains) {
        StringBuilder line = new StringBuilder();
        line.append(String.format(Locale.ROOT, "id=%d, time=%.5e, position=(%.3e:%.3e:%.3e)",
                particle.id(), time, particle.x(), particle.y(), particle.z().orElse(0.0)));
        if (particle.elastic().isPresent() && particle.olivineDeformationType().isPresent()) {
            line.append(String.format(Locale.ROOT, ", ODT=%.4f", particle.olivineDeformationType().getAsDouble()));
        }
        line.append(", grains=").append(grains);
        particle.elastic().ifPresent(elastic -> line.append(String.format(Locale.ROOT, ", anisotropic%%=%.4f",
                new ElasticAnisotropySummary(elastic).anisotropicPercent())));
        return line.toString();
    }

    /**
     * One two-line column per symmetry family, e.g. {@code {"hex%=1.00,2.00,3.00", "h/a%=..."}}.
     *
     * @return columns in {@link SymmetryClass} order, empty without decomposition.
     */
    static List<String[]> symmetryColumns(ParticleRecord particle) {
        List<String[]> columns = new ArrayList<>();
        particle.elastic().ifPresent(elastic -> {
            ElasticAnisotropySummary summary = new ElasticAnisotropySummary(elastic);
            for (SymmetryClass symmetry : SymmetryClass.values()) {
                columns.add(new String[] {
                    String.format(Locale.ROOT, "%s%%=%.2f,%.2f,%.2f", symmetry.shortName(),
                            summary.percentOfFull(symmetry, 0),
                            summary.percentOfFull(symmetry, 1),
                            summary.percentOfFull(symmetry, 2)),
                    String.format(Locale.ROOT, "%s/a%%=%.2f,%.2f,%.2f", symmetry.initial(),
                            summary.percentOfAnisotropy(symmetry, 0),
                            summary.percentOfAnisotropy(symmetry, 1),
                            summary.percentOfAnisotropy(symmetry, 2))
                });
            }
        });
        return columns;
    }
}
