package org.cpoanalyzer.data;

/**
 * Maps a requested model time to the closest recorded timestep.
 * <p>
 * The times are expected in ascending order, starting near zero. Unsorted input is not
 * detected and gives an arbitrary neighbour.
 */
public final class TimeResolver {

    private TimeResolver() {
    }

    /**
     * Finds the first timestep whose time strictly exceeds {@code requested} (or the last
     * timestep if none does) and compares it with its predecessor. Ties go to the predecessor.
     *
     * @param times     recorded times, ascending.
     * @param requested requested time.
     * @return index of the closest timestep.
     * @throws IllegalArgumentException if {@code times} is empty.
     */
    public static int resolve(double[] times, double requested) {
        if (times.length == 0) {
            throw new IllegalArgumentException("No recorded times to resolve " + requested + " against");
        }
        int after = times.length - 1;
        for (int i = 0; i < times.length; i++) {
            if (times[i] > requested) {
                after = i;
                break;
            }
        }
        int before = after > 0 ? after - 1 : 0;

        double beforeDiff = Math.abs(requested - times[before]);
        double afterDiff = Math.abs(requested - times[after]);
        return beforeDiff <= afterDiff ? before : after;
    }
}
