package org.cpoanalyzer.data;

import java.nio.file.Path;

/**
 * Thrown when a shard or time-index file cannot be decoded: undecodable compressed stream,
 * missing column, unparsable numeric field or a row with too few fields.
 * <p>
 * This is a checked exception. It is fatal for the particle/timestep request that hit it
 * and aborts the surrounding experiment; no partial pole figure is produced.
 * <p>
 * <strong>Error Handling Pattern:</strong>
 * <pre>{@code
 * try {
 *     result = locator.locate(timestep, particleId);
 * } catch (MalformedRecordException e) {
 *     log.error("Aborting experiment {}: {}", experimentDir, e.getMessage());
 *     return ExperimentResult.failed(experimentDir, rendered, missing, e.getMessage());
 * }
 * }</pre>
 */
public class MalformedRecordException extends Exception {

    private final Path file;

    /**
     * @param file    the file that could not be decoded.
     * @param message what was wrong, including the field or line where known.
     */
    public MalformedRecordException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    /**
     * @param file    the file that could not be decoded.
     * @param message what was wrong, including the field or line where known.
     * @param cause   underlying parse or decompression failure.
     */
    public MalformedRecordException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
