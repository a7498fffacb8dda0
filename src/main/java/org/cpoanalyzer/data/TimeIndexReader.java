package org.cpoanalyzer.data;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * Reads the timestep-to-time mapping from the simulation's statistics file.
 * <p>
 * Lines starting with {@code #} are comments. Of the remaining lines, those containing the
 * marker token (the name of the particle output, {@code particle_LPO} by default) are the
 * timesteps at which particle data was written; their second whitespace-separated field is
 * the model time. The n-th matching line is timestep n.
 */
public final class TimeIndexReader {

    /** Marker used by the simulation when no other is configured. */
    public static final String DEFAULT_MARKER = "particle_LPO";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TimeIndexReader() {
    }

    /**
     * @param file   statistics file.
     * @param marker token identifying rows with particle output.
     * @return times in row order.
     * @throws MalformedRecordException if a matching row has no time field or it is not a number.
     * @throws IOException              if the file cannot be read.
     */
    public static double[] read(Path file, String marker) throws MalformedRecordException, IOException {
        DoubleArrayList times = new DoubleArrayList();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.startsWith("#") || !trimmed.contains(marker)) {
                    continue;
                }
                String[] fields = WHITESPACE.split(trimmed);
                if (fields.length < 2) {
                    throw new MalformedRecordException(file, "line " + lineNumber + ": time field missing");
                }
                double time;
                try {
                    time = Double.parseDouble(fields[1]);
                } catch (NumberFormatException e) {
                    throw new MalformedRecordException(file,
                            "line " + lineNumber + ": time field is not a number: '" + fields[1] + "'", e);
                }
                times.add(time);
            }
        }
        return times.toDoubleArray();
    }
}
