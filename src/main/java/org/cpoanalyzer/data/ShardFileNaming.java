package org.cpoanalyzer.data;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * File names of per-worker shard files: {@code <dir><prefix>-<timestep:5>.<shard:4>.<ext>}.
 * Directory and prefix are concatenated as strings, so the directory carries its own
 * trailing separator.
 *
 * @param directory experiment directory, e.g. {@code /data/run_1/}.
 * @param prefix    file prefix relative to the directory, e.g. {@code particle_CPO/weighted_CPO}.
 * @param extension file extension without the dot.
 */
public record ShardFileNaming(String directory, String prefix, String extension) {

    public Path shardFile(long timestep, int shardIndex) {
        return Paths.get(String.format("%s%s-%05d.%04d.%s", directory, prefix, timestep, shardIndex, extension));
    }
}
