package edu.stanford.futuredata.geoshard.pipeline;

import java.util.Objects;

/** What the job queue reports about one remote job. */
public final class JobStatus {
    public final JobState state;
    // Why the job failed, as reported by the queue; empty otherwise.
    public final String reason;

    public JobStatus(JobState state, String reason) {
        this.state = Objects.requireNonNull(state);
        this.reason = reason == null ? "" : reason;
    }

    public static JobStatus of(JobState state) {
        return new JobStatus(state, "");
    }

    public static JobStatus failed(String reason) {
        return new JobStatus(JobState.FAILED, reason);
    }

    @Override
    public String toString() {
        return reason.isEmpty() ? state.name() : state + " (" + reason + ")";
    }
}
