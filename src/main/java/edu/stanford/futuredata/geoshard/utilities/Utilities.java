package edu.stanford.futuredata.geoshard.utilities;

import java.util.List;

public class Utilities {

    // Percentile of an unsorted list of latencies, or zero if empty.
    public static long percentile(List<Long> values, int percentile) {
        if (values.isEmpty()) {
            return 0;
        }
        long[] sorted = values.stream().mapToLong(i -> i).sorted().toArray();
        return sorted[Math.min(sorted.length - 1, sorted.length * percentile / 100)];
    }
}
