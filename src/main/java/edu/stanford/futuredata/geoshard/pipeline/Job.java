package edu.stanford.futuredata.geoshard.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * One preprocessing step of a pipeline.
 *
 * PENDING -> SUBMITTED -> RUNNING -> SUCCEEDED | FAILED.  A FAILED job with attempts left goes back to SUBMITTED
 * when resubmitted.  Only the orchestrator's scheduling thread changes a job.
 */
public class Job {
    public final String id;
    public final JobKind kind;
    public final String shardID;
    public final JobSpec spec;
    // Ids of jobs that must succeed before this one is submitted.
    public final Set<String> dependencies;
    public final int maxAttempts;

    private JobState state = JobState.PENDING;
    private int attemptCount = 0;
    private String remoteJobID = null;
    private String lastError = null;
    // Set when a failure must not be retried.
    private boolean permanent = false;
    private final List<JobState> history = new ArrayList<>(List.of(JobState.PENDING));

    Job(String id, JobSpec spec, Set<String> dependencies, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.id = id;
        this.kind = spec.kind;
        this.shardID = spec.shardID;
        this.spec = spec;
        this.dependencies = Set.copyOf(dependencies);
        this.maxAttempts = maxAttempts;
    }

    public JobState getState() {
        return state;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public String getRemoteJobID() {
        return remoteJobID;
    }

    public String getLastError() {
        return lastError;
    }

    /** Every state the job has been in, in order. */
    public List<JobState> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Whether the job may be submitted now, ignoring dependencies. */
    boolean isSubmittable() {
        return state == JobState.PENDING || isRetryable();
    }

    boolean isRetryable() {
        return state == JobState.FAILED && !permanent && attemptCount < maxAttempts;
    }

    /** Failed with no attempts left, rejected by the queue, or cancelled. */
    public boolean isFailedPermanently() {
        return state == JobState.FAILED && !isRetryable();
    }

    void submitted(String remoteJobID) {
        if (!isSubmittable()) {
            throw new IllegalStateException(String.format("Job %s cannot be submitted in state %s", id, state));
        }
        this.remoteJobID = remoteJobID;
        attemptCount++;
        moveTo(JobState.SUBMITTED);
    }

    void running() {
        require(JobState.SUBMITTED);
        moveTo(JobState.RUNNING);
    }

    void succeeded() {
        require(JobState.RUNNING);
        moveTo(JobState.SUCCEEDED);
    }

    void failed(String error) {
        if (!state.isActive()) {
            throw new IllegalStateException(String.format("Job %s cannot fail in state %s", id, state));
        }
        lastError = error;
        moveTo(JobState.FAILED);
    }

    /**
     * The submission itself failed, so the job never reached the queue.  A rejected specification is never
     * retried; an unreachable queue counts as a failed attempt.
     */
    void submissionFailed(String error, boolean retryable) {
        if (!isSubmittable()) {
            throw new IllegalStateException(String.format("Job %s was not being submitted (%s)", id, state));
        }
        attemptCount++;
        lastError = error;
        permanent = !retryable;
        if (state != JobState.FAILED) {
            moveTo(JobState.FAILED);
        }
    }

    /** Stop the job for good.  Returns whether it was still live. */
    boolean cancel(String reason) {
        if (state == JobState.SUCCEEDED || isFailedPermanently()) {
            return false;
        }
        permanent = true;
        lastError = reason;
        if (state != JobState.FAILED) {
            moveTo(JobState.FAILED);
        }
        return true;
    }

    private void require(JobState expected) {
        if (state != expected) {
            throw new IllegalStateException(String.format("Job %s is %s, expected %s", id, state, expected));
        }
    }

    private void moveTo(JobState next) {
        state = next;
        history.add(next);
    }

    @Override
    public String toString() {
        return String.format("Job[%s %s attempt %d/%d]", id, state, attemptCount, maxAttempts);
    }
}
