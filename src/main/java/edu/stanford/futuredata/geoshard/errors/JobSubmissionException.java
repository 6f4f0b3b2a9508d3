package edu.stanford.futuredata.geoshard.errors;

/**
 * The job queue rejected a job specification.  Indicates a configuration defect; never retried.
 */
public class JobSubmissionException extends GeoShardException {

    public JobSubmissionException(String message) {
        super(ReasonCode.JOB_SUBMISSION_ERROR, message);
    }

    public JobSubmissionException(String message, Throwable cause) {
        super(ReasonCode.JOB_SUBMISSION_ERROR, message, cause);
    }
}
