package edu.stanford.futuredata.geoshard.pipeline;

import java.util.List;
import java.util.Locale;

/**
 * Graph preprocessing strategy of a deployment: Contraction Hierarchies or Multi-Level Dijkstra.  Each mode is a
 * chain of jobs; every job depends on the one before it.
 */
public enum AlgorithmMode {
    CH(List.of(JobKind.EXTRACT, JobKind.CONTRACT)),
    MLD(List.of(JobKind.EXTRACT, JobKind.PARTITION, JobKind.CUSTOMIZE));

    private final List<JobKind> jobKinds;

    AlgorithmMode(List<JobKind> jobKinds) {
        this.jobKinds = jobKinds;
    }

    public List<JobKind> jobKinds() {
        return jobKinds;
    }

    public static AlgorithmMode parse(String s) {
        try {
            return AlgorithmMode.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown algorithm mode " + s + ", expected ch or mld");
        }
    }
}
