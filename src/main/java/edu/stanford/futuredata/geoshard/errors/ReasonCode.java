package edu.stanford.futuredata.geoshard.errors;

/** Machine-readable failure reasons returned to clients and recorded on failed pipelines. */
public enum ReasonCode {
    NO_SHARD_COVERAGE(true),
    SHARD_UNAVAILABLE(true),
    UNROUTABLE_CROSS_SHARD(true),
    BACKEND_ERROR(true),
    BACKEND_TIMEOUT(false),
    BACKEND_UNAVAILABLE(false),
    STITCH_INCONSISTENT(false),
    CANCELLED(true),
    INVALID_REQUEST(true),
    JOB_SUBMISSION_ERROR(false),
    JOB_FAILED_PERMANENT(false),
    INTERNAL_ERROR(false);

    // Whether the failure is attributable to the request rather than to the service.
    public final boolean clientFacing;

    ReasonCode(boolean clientFacing) {
        this.clientFacing = clientFacing;
    }
}
