package org.cpoanalyzer.data;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of scanning the shards of one timestep for one particle.
 */
public sealed interface ShardScanResult {

    /**
     * @return number of shard files that were inspected.
     */
    int shardsScanned();

    /**
     * The particle's grains were found.
     *
     * @param shardIndex    shard that held the grains.
     * @param grainFile     grain shard file.
     * @param grains        all grains of the particle in that shard, in file order.
     * @param particle      metadata from the matching metadata shard, zeroed if absent there.
     * @param shardsScanned shards inspected including this one.
     */
    record Found(int shardIndex, Path grainFile, List<GrainRecord> grains, ParticleRecord particle,
                 int shardsScanned) implements ShardScanResult {

        public Found {
            grains = List.copyOf(grains);
        }
    }

    /**
     * Every existing shard was inspected without a match.
     *
     * @param missingFile   first shard file that does not exist, which ended the scan.
     * @param shardsScanned shards inspected.
     */
    record NotFound(Path missingFile, int shardsScanned) implements ShardScanResult {
    }
}
