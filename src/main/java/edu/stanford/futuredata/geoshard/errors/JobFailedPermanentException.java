package edu.stanford.futuredata.geoshard.errors;

import edu.stanford.futuredata.geoshard.pipeline.JobKind;

/** A job exhausted its attempts. */
public class JobFailedPermanentException extends GeoShardException {

    private final JobKind kind;
    private final String shardID;
    private final int attempts;

    public JobFailedPermanentException(JobKind kind, String shardID, int attempts, String finalError) {
        super(ReasonCode.JOB_FAILED_PERMANENT,
                String.format("%s job for shard %s failed after %d attempts: %s", kind, shardID, attempts, finalError));
        this.kind = kind;
        this.shardID = shardID;
        this.attempts = attempts;
    }

    public JobKind getKind() {
        return kind;
    }

    public String getShardID() {
        return shardID;
    }

    public int getAttempts() {
        return attempts;
    }
}
