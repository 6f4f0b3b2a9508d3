package edu.stanford.futuredata.geoshard.pipeline;

public enum JobState {
    PENDING,
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isActive() {
        return this == SUBMITTED || this == RUNNING;
    }
}
