package edu.stanford.futuredata.geoshard.pipeline;

import edu.stanford.futuredata.geoshard.errors.GeoShardException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The jobs of one build run for one shard.  Its state follows from its jobs': SUCCEEDED once every job has,
 * FAILED as soon as one fails for good.
 */
public class Pipeline {
    public final String shardID;
    public final String runID;
    public final AlgorithmMode mode;
    // Graph the shard serves once the pipeline succeeds.
    public final String artifact;

    // Dependency order.
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private volatile PipelineState state = PipelineState.PENDING;
    private volatile GeoShardException failure = null;
    private final CompletableFuture<Pipeline> completion = new CompletableFuture<>();

    Pipeline(String shardID, String runID, AlgorithmMode mode, String artifact, List<Job> jobs) {
        this.shardID = shardID;
        this.runID = runID;
        this.mode = mode;
        this.artifact = artifact;
        for (Job j : jobs) {
            for (String dependency : j.dependencies) {
                if (!this.jobs.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                            String.format("Job %s depends on %s, which does not precede it", j.id, dependency));
                }
            }
            this.jobs.put(j.id, j);
        }
    }

    public List<Job> getJobs() {
        return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
    }

    public Optional<Job> getJob(JobKind kind) {
        return jobs.values().stream().filter(j -> j.kind == kind).findFirst();
    }

    public PipelineState getState() {
        return state;
    }

    /** Why the pipeline failed, if it did. */
    public Optional<GeoShardException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<Job> getFailedJob() {
        return jobs.values().stream().filter(Job::isFailedPermanently).findFirst();
    }

    /** Completes, never exceptionally, once the pipeline is SUCCEEDED, FAILED or CANCELLED. */
    public CompletableFuture<Pipeline> getCompletion() {
        return completion;
    }

    /** Jobs whose dependencies have all succeeded and that may be submitted. */
    List<Job> readyJobs() {
        List<Job> ready = new ArrayList<>();
        for (Job j : jobs.values()) {
            if (j.isSubmittable() && j.dependencies.stream().allMatch(d -> jobs.get(d).getState() == JobState.SUCCEEDED)) {
                ready.add(j);
            }
        }
        return ready;
    }

    PipelineState deriveState() {
        if (state == PipelineState.CANCELLED) {
            return state;
        }
        if (jobs.values().stream().anyMatch(Job::isFailedPermanently)) {
            return PipelineState.FAILED;
        }
        if (jobs.values().stream().allMatch(j -> j.getState() == JobState.SUCCEEDED)) {
            return PipelineState.SUCCEEDED;
        }
        if (jobs.values().stream().allMatch(j -> j.getState() == JobState.PENDING)) {
            return state == PipelineState.RUNNING ? PipelineState.RUNNING : PipelineState.PENDING;
        }
        return PipelineState.RUNNING;
    }

    boolean isTerminalJob(Job job) {
        return jobs.values().stream().noneMatch(j -> j.dependencies.contains(job.id));
    }

    void setState(PipelineState state) {
        this.state = state;
    }

    void finish(PipelineState finalState, GeoShardException failure) {
        this.failure = failure;
        this.state = finalState;
        completion.complete(this);
    }

    @Override
    public String toString() {
        return String.format("Pipeline[%s run %s %s %s]", shardID, runID, mode, state);
    }
}
