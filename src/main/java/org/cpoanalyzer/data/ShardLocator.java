package org.cpoanalyzer.data;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.zip.ZipException;

import org.cpoanalyzer.data.compression.ICompressionCodec;
import org.cpoanalyzer.orientation.EulerAngles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the grain orientations and metadata of one particle at one timestep among the
 * per-worker shard files.
 * <p>
 * Shards are scanned in increasing index order starting at 0:
 * <ol>
 *   <li>shard file absent: the scan is exhausted, the particle does not exist at this timestep;</li>
 *   <li>shard file empty, or decoding to neither header nor rows: the worker had no particles,
 *       continue with the next shard;</li>
 *   <li>no row for the particle: continue with the next shard;</li>
 *   <li>at least one row: collect all of them, read the metadata shard with the same index and stop.</li>
 * </ol>
 * All grains of a particle are assumed to live in one shard per timestep. This is not
 * verified: grains in later shards are never read.
 * <p>
 * Grain shards are decoded with the configured codec; metadata shards are always plain text.
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from immutable configuration; safe to share.
 * Each shard file is opened, decoded and closed before the next one is touched.
 */
public class ShardLocator {

    private static final Logger log = LoggerFactory.getLogger(ShardLocator.class);

    static final String ID_COLUMN = "id";

    private final ShardFileNaming grainFiles;
    private final ShardFileNaming particleFiles;
    private final ICompressionCodec codec;

    /**
     * @param grainFiles    naming of grain orientation shards.
     * @param particleFiles naming of particle metadata shards.
     * @param codec         codec of the grain shards.
     */
    public ShardLocator(ShardFileNaming grainFiles, ShardFileNaming particleFiles, ICompressionCodec codec) {
        this.grainFiles = grainFiles;
        this.particleFiles = particleFiles;
        this.codec = codec;
    }

    /**
     * Scans the shards of {@code timestep} for {@code particleId}.
     *
     * @param timestep   simulation timestep index.
     * @param particleId particle to look for.
     * @return {@link ShardScanResult.Found} or {@link ShardScanResult.NotFound}.
     * @throws MalformedRecordException if a shard that had to be read cannot be decoded.
     * @throws IOException              if a shard cannot be read, including a missing metadata shard.
     */
    public ShardScanResult locate(long timestep, long particleId) throws MalformedRecordException, IOException {
        int shardIndex = 0;
        while (true) {
            Path grainFile = grainFiles.shardFile(timestep, shardIndex);
            if (!Files.exists(grainFile)) {
                log.debug("Shard scan for particle {} at timestep {} exhausted at {}", particleId, timestep, grainFile);
                return new ShardScanResult.NotFound(grainFile, shardIndex);
            }
            if (Files.size(grainFile) == 0) {
                log.debug("Skipping empty shard {}", grainFile);
                shardIndex++;
                continue;
            }

            List<GrainRecord> grains = readGrains(grainFile, particleId);
            if (grains.isEmpty()) {
                shardIndex++;
                continue;
            }

            log.debug("Found {} grains of particle {} in {}", grains.size(), particleId, grainFile);
            ParticleRecord particle = readParticle(particleFiles.shardFile(timestep, shardIndex), particleId);
            return new ShardScanResult.Found(shardIndex, grainFile, grains, particle, shardIndex + 1);
        }
    }

    private List<GrainRecord> readGrains(Path file, long particleId) throws MalformedRecordException, IOException {
        DelimitedTable table;
        try (InputStream in = codec.wrapInputStream(Files.newInputStream(file))) {
            table = DelimitedTable.read(file, in);
        } catch (ZipException | EOFException e) {
            throw new MalformedRecordException(file, "undecodable " + codec.getName() + " stream: " + e.getMessage(), e);
        }
        if (table.isEmpty()) {
            // a compressed shard of a worker without particles decodes to nothing
            log.debug("Skipping shard {} without header", file);
            return List.of();
        }

        int mineralCount = countMineralColumns(table);
        if (mineralCount == 0) {
            throw new MalformedRecordException(file, "missing column '" + angleColumn(0, "phi") + "'");
        }

        List<GrainRecord> grains = new ArrayList<>();
        for (DelimitedTable.Row row : table.rows()) {
            if (table.getLong(row, ID_COLUMN) != particleId) {
                continue;
            }
            List<EulerAngles> angles = new ArrayList<>(mineralCount);
            for (int mineral = 0; mineral < mineralCount; mineral++) {
                angles.add(EulerAngles.ofDegrees(
                        table.getDouble(row, angleColumn(mineral, "phi")),
                        table.getDouble(row, angleColumn(mineral, "theta")),
                        table.getDouble(row, angleColumn(mineral, "z"))));
            }
            grains.add(new GrainRecord(particleId, angles));
        }
        return grains;
    }

    private ParticleRecord readParticle(Path file, long particleId) throws MalformedRecordException, IOException {
        DelimitedTable table;
        try (InputStream in = Files.newInputStream(file)) {
            table = DelimitedTable.read(file, in);
        }

        ParticleRecord found = null;
        for (DelimitedTable.Row row : table.rows()) {
            // last matching row wins
            if (table.getLong(row, ID_COLUMN) == particleId) {
                found = decodeParticle(table, row, particleId);
            }
        }
        if (found == null) {
            log.warn("Particle {} has grains but no metadata row in {}, using zeroed metadata", particleId, file);
            return ParticleRecord.zeroed(particleId);
        }
        return found;
    }

    private static ParticleRecord decodeParticle(DelimitedTable table, DelimitedTable.Row row, long particleId)
            throws MalformedRecordException {
        return new ParticleRecord(
                particleId,
                table.getDouble(row, "x"),
                table.getDouble(row, "y"),
                table.getOptionalDouble(row, "z"),
                table.getOptionalDouble(row, "olivine_deformation_type"),
                decodeElastic(table, row));
    }

    /**
     * The decomposition is present only when the full norm and all partial norms are recorded.
     */
    private static Optional<ElasticDecomposition> decodeElastic(DelimitedTable table, DelimitedTable.Row row)
            throws MalformedRecordException {
        if (!table.hasColumn("full_norm_square")) {
            return Optional.empty();
        }
        Map<SymmetryClass, double[]> partials = new EnumMap<>(SymmetryClass.class);
        for (SymmetryClass symmetry : SymmetryClass.values()) {
            double[] components = new double[SymmetryClass.COMPONENTS];
            for (int c = 0; c < SymmetryClass.COMPONENTS; c++) {
                String column = symmetry.column(c + 1);
                if (!table.hasColumn(column)) {
                    return Optional.empty();
                }
                components[c] = table.getDouble(row, column);
            }
            partials.put(symmetry, components);
        }
        OptionalDouble isotropic = table.getOptionalDouble(row, "isotropic_norm_square");
        return Optional.of(new ElasticDecomposition(table.getDouble(row, "full_norm_square"), isotropic, partials));
    }

    private static int countMineralColumns(DelimitedTable table) {
        int count = 0;
        while (table.hasColumn(angleColumn(count, "phi"))) {
            count++;
        }
        return count;
    }

    static String angleColumn(int mineral, String angle) {
        return "mineral_" + mineral + "_EA_" + angle;
    }
}
