package org.cpoanalyzer.data;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Per-particle metadata at one timestep.
 *
 * @param id                     particle id.
 * @param x                      first position coordinate.
 * @param y                      second position coordinate.
 * @param z                      third coordinate, absent for 2-D models.
 * @param olivineDeformationType deformation type classifier, when recorded.
 * @param elastic                elastic anisotropy decomposition, when recorded.
 */
public record ParticleRecord(long id, double x, double y, OptionalDouble z,
                             OptionalDouble olivineDeformationType,
                             Optional<ElasticDecomposition> elastic) {

    /**
     * Metadata used when the particle is absent from its metadata shard: zero position,
     * nothing else recorded.
     *
     * @param id the requested particle id.
     */
    public static ParticleRecord zeroed(long id) {
        return new ParticleRecord(id, 0.0, 0.0, OptionalDouble.of(0.0), OptionalDouble.empty(), Optional.empty());
    }
}
