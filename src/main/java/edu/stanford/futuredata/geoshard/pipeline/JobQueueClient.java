package edu.stanford.futuredata.geoshard.pipeline;

/**
 * A remote batch-execution service.  Implementations must be safe to call from several threads.
 */
public interface JobQueueClient {
    /**
     * Submit a job.
     * @return the queue's id for the job
     * @throws edu.stanford.futuredata.geoshard.errors.JobSubmissionException if the queue rejects the job
     * @throws edu.stanford.futuredata.geoshard.errors.BackendUnavailableException if the queue cannot be reached
     */
    String submit(JobSpec spec);

    /** Current state of a submitted job.  A job the queue does not know about is reported FAILED. */
    JobStatus poll(String jobID);

    /** Ask the queue to stop a job.  Returns whether the queue acknowledged. */
    boolean cancel(String jobID);

    default void shutdown() {}
}
