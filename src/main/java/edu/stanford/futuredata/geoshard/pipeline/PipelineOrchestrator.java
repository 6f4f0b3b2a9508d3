package edu.stanford.futuredata.geoshard.pipeline;

import edu.stanford.futuredata.geoshard.errors.GeoShardException;
import edu.stanford.futuredata.geoshard.errors.JobFailedPermanentException;
import edu.stanford.futuredata.geoshard.errors.JobSubmissionException;
import edu.stanford.futuredata.geoshard.registry.Shard;
import edu.stanford.futuredata.geoshard.registry.ShardRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Builds shard graphs by driving each shard's job chain through a {@link JobQueueClient}.
 *
 * All pipeline and job state belongs to a single scheduling thread.  Calls to the queue run on a separate pool
 * and report back to the scheduling thread, so a slow queue never blocks other pipelines.  Jobs are submitted
 * only once their dependencies succeeded, at most maxInFlightJobs at a time across all pipelines.
 */
public class PipelineOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final JobQueueClient jobQueue;
    private final ShardRegistry registry;
    // Optional; when set, a pipeline's output must exist before the shard is promoted.
    private final ArtifactStore artifactStore;
    private final PipelineConfig config;
    private final PollBackoff pollBackoff;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pipeline-scheduler");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService jobQueueThreadPool;
    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

    // Scheduling thread only.
    private final Deque<Pipeline> waitingPipelines = new ArrayDeque<>();
    private final List<Pipeline> activePipelines = new ArrayList<>();
    // Jobs being submitted, SUBMITTED or RUNNING.
    private final Set<Job> inFlightJobs = new HashSet<>();

    // Unfinished pipeline of each shard.
    private final Map<String, Pipeline> shardPipelines = new ConcurrentHashMap<>();
    private final AtomicInteger runNumber = new AtomicInteger(0);

    public PipelineOrchestrator(JobQueueClient jobQueue, ShardRegistry registry, ArtifactStore artifactStore,
                                PipelineConfig config) {
        this.jobQueue = jobQueue;
        this.registry = registry;
        this.artifactStore = artifactStore;
        this.config = config;
        this.pollBackoff = config.pollBackoff();
        this.jobQueueThreadPool = Executors.newFixedThreadPool(config.jobQueueThreads);
    }

    public void addListener(JobEventListener listener) {
        listeners.add(listener);
    }

    public Pipeline runPipeline(String shardID) {
        return runPipeline(shardID, config.algorithmMode);
    }

    /**
     * Start building a shard.  Returns at once; the pipeline's completion future tells when it is done.
     * @throws JobSubmissionException if the shard's job specifications are invalid
     * @throws IllegalStateException if the shard is already being built
     */
    public Pipeline runPipeline(String shardID, AlgorithmMode mode) {
        Shard shard = registry.requireShard(shardID);
        Pipeline p = buildPipeline(shard, newRunID(), mode);
        if (shardPipelines.putIfAbsent(shardID, p) != null) {
            throw new IllegalStateException("Shard " + shardID + " is already being built");
        }
        scheduler.execute(guarded(() -> {
            waitingPipelines.add(p);
            schedule();
        }));
        return p;
    }

    /** Start building several shards.  A shard whose pipeline cannot be created is logged and skipped. */
    public List<Pipeline> runPipelines(Collection<String> shardIDs, AlgorithmMode mode) {
        List<Pipeline> pipelines = new ArrayList<>();
        for (String shardID : shardIDs) {
            try {
                pipelines.add(runPipeline(shardID, mode));
            } catch (JobSubmissionException | IllegalStateException | IllegalArgumentException e) {
                logger.error("Not building shard {}: {}", shardID, e.getMessage());
            }
        }
        return pipelines;
    }

    public List<Pipeline> runAll(AlgorithmMode mode) {
        return runPipelines(registry.getShards().stream().map(s -> s.id).collect(Collectors.toList()), mode);
    }

    /** Cancel every job of the pipeline that is not finished yet.  The returned future completes once it has. */
    public CompletableFuture<Pipeline> cancelPipeline(Pipeline p) {
        scheduler.execute(guarded(() -> {
            if (p.getState().isDone()) {
                return;
            }
            logger.info("Cancelling pipeline for shard {} run {}", p.shardID, p.runID);
            stopJobs(p, "Pipeline cancelled");
            finish(p, PipelineState.CANCELLED, null);
            schedule();
        }));
        return p.getCompletion();
    }

    public void shutdown() {
        scheduler.shutdownNow();
        jobQueueThreadPool.shutdown();
        if (!shardPipelines.isEmpty()) {
            logger.warn("Shutting down with unfinished pipelines for {}", shardPipelines.keySet());
        }
        jobQueue.shutdown();
    }

    Pipeline buildPipeline(Shard shard, String runID, AlgorithmMode mode) {
        String outputDirectory = String.format("%s%s/%s/", config.outputLocation, shard.id, runID);
        String osmFile = shard.source != null ? shard.source : config.sliceLocation + shard.id + ".osm.pbf";
        List<Job> jobs = new ArrayList<>();
        Job previous = null;
        for (JobKind kind : mode.jobKinds()) {
            JobSpec spec = JobSpec.newBuilder()
                    .setKind(kind)
                    .setShardID(shard.id)
                    .setRunID(runID)
                    .setOsmFile(osmFile)
                    .setProfile(config.profile)
                    .setOutputDirectory(outputDirectory)
                    .build();
            Job j = new Job(String.format("%s/%s/%s", shard.id, runID, kind.operation), spec,
                    previous == null ? Set.of() : Set.of(previous.id), config.maxAttempts);
            jobs.add(j);
            previous = j;
        }
        return new Pipeline(shard.id, runID, mode, previous.spec.osrmFile, jobs);
    }

    private String newRunID() {
        return String.format("%d-%d", Instant.now().getEpochSecond(), runNumber.incrementAndGet());
    }

    /*
     * SCHEDULING THREAD
     */

    // Admit waiting pipelines and submit every ready job there is room for.
    private void schedule() {
        while (activePipelines.size() < config.maxConcurrentPipelines && !waitingPipelines.isEmpty()) {
            Pipeline p = waitingPipelines.poll();
            p.setState(PipelineState.RUNNING);
            activePipelines.add(p);
            logger.info("Starting {} pipeline for shard {} run {}", p.mode, p.shardID, p.runID);
        }
        for (Pipeline p : new ArrayList<>(activePipelines)) {
            for (Job j : p.readyJobs()) {
                if (inFlightJobs.size() >= config.maxInFlightJobs) {
                    return;
                }
                if (!inFlightJobs.contains(j)) {
                    submit(p, j);
                }
            }
        }
    }

    private void submit(Pipeline p, Job j) {
        inFlightJobs.add(j);
        CompletableFuture.supplyAsync(() -> jobQueue.submit(j.spec), jobQueueThreadPool)
                .whenCompleteAsync((remoteJobID, e) -> guarded(() -> onSubmitted(p, j, remoteJobID, e)).run(), scheduler);
    }

    private void onSubmitted(Pipeline p, Job j, String remoteJobID, Throwable e) {
        if (p.getState().isDone()) {
            inFlightJobs.remove(j);
            if (remoteJobID != null) {
                cancelRemote(remoteJobID);
            }
            return;
        }
        if (e != null) {
            inFlightJobs.remove(j);
            Throwable cause = unwrap(e);
            if (cause instanceof JobSubmissionException) {
                logger.error("Queue rejected {} job for shard {}: {}", j.kind, j.shardID, cause.getMessage());
                transition(j, () -> j.submissionFailed(cause.getMessage(), false));
                fail(p, (JobSubmissionException) cause);
            } else {
                logger.warn("Submitting {} job for shard {} failed: {}", j.kind, j.shardID, cause.getMessage());
                transition(j, () -> j.submissionFailed(cause.getMessage(), true));
                checkPipeline(p);
            }
            schedule();
            return;
        }
        transition(j, () -> j.submitted(remoteJobID));
        logger.info("Submitted {} as {} (attempt {}/{})", j.spec.jobName, remoteJobID, j.getAttemptCount(),
                j.maxAttempts);
        schedulePoll(p, j, 0, 0);
    }

    private void schedulePoll(Pipeline p, Job j, int pollNumber, int pollFailures) {
        scheduler.schedule(guarded(() -> poll(p, j, pollNumber, pollFailures)), pollBackoff.delayMillis(pollNumber),
                TimeUnit.MILLISECONDS);
    }

    private void poll(Pipeline p, Job j, int pollNumber, int pollFailures) {
        if (p.getState().isDone() || !j.getState().isActive()) {
            return;
        }
        String remoteJobID = j.getRemoteJobID();
        int attempt = j.getAttemptCount();
        CompletableFuture.supplyAsync(() -> jobQueue.poll(remoteJobID), jobQueueThreadPool)
                .whenCompleteAsync((status, e) -> guarded(() -> onPolled(p, j, attempt, pollNumber, pollFailures, status, e))
                        .run(),
                        scheduler);
    }

    private void onPolled(Pipeline p, Job j, int attempt, int pollNumber, int pollFailures, JobStatus status,
                          Throwable e) {
        if (p.getState().isDone() || !j.getState().isActive() || j.getAttemptCount() != attempt) {
            return;
        }
        if (e != null) {
            String message = unwrap(e).getMessage();
            if (pollFailures + 1 >= config.maxPollFailures) {
                // The job may still be running; stop it before the attempt is counted as failed.
                cancelRemote(j.getRemoteJobID());
                jobFailed(p, j, String.format("Polling failed %d times: %s", pollFailures + 1, message));
            } else {
                logger.warn("Polling {} ({}) failed: {}", j.spec.jobName, j.getRemoteJobID(), message);
                schedulePoll(p, j, pollNumber + 1, pollFailures + 1);
            }
            return;
        }
        switch (status.state) {
            case PENDING:
            case SUBMITTED:
                schedulePoll(p, j, pollNumber + 1, 0);
                break;
            case RUNNING:
                if (j.getState() == JobState.SUBMITTED) {
                    transition(j, j::running);
                }
                schedulePoll(p, j, pollNumber + 1, 0);
                break;
            case SUCCEEDED:
                // A short job may finish between two polls.
                if (j.getState() == JobState.SUBMITTED) {
                    transition(j, j::running);
                }
                if (artifactStore != null && p.isTerminalJob(j)) {
                    verifyArtifact(p, j, attempt);
                } else {
                    jobSucceeded(p, j);
                }
                break;
            case FAILED:
                jobFailed(p, j, status.reason);
                break;
        }
    }

    private void verifyArtifact(Pipeline p, Job j, int attempt) {
        CompletableFuture.supplyAsync(() -> artifactStore.exists(p.artifact), jobQueueThreadPool)
                .whenCompleteAsync((exists, e) -> guarded(() -> {
                    if (p.getState().isDone() || j.getState() != JobState.RUNNING || j.getAttemptCount() != attempt) {
                        return;
                    }
                    if (e != null) {
                        jobFailed(p, j, "Could not verify " + p.artifact + ": " + unwrap(e).getMessage());
                    } else if (!exists) {
                        jobFailed(p, j, "Artifact " + p.artifact + " missing after " + j.kind);
                    } else {
                        jobSucceeded(p, j);
                    }
                }).run(), scheduler);
    }

    private void jobSucceeded(Pipeline p, Job j) {
        transition(j, j::succeeded);
        inFlightJobs.remove(j);
        logger.info("{} job for shard {} SUCCEEDED on attempt {}", j.kind, j.shardID, j.getAttemptCount());
        checkPipeline(p);
        schedule();
    }

    private void jobFailed(Pipeline p, Job j, String reason) {
        transition(j, () -> j.failed(reason));
        inFlightJobs.remove(j);
        if (j.isRetryable()) {
            logger.warn("{} job for shard {} failed on attempt {}/{}, retrying: {}", j.kind, j.shardID,
                    j.getAttemptCount(), j.maxAttempts, reason);
        } else {
            logger.error("{} job for shard {} failed on attempt {}/{}: {}", j.kind, j.shardID,
                    j.getAttemptCount(), j.maxAttempts, reason);
        }
        checkPipeline(p);
        schedule();
    }

    private void checkPipeline(Pipeline p) {
        PipelineState s = p.deriveState();
        if (s == PipelineState.SUCCEEDED) {
            // The previous artifact keeps serving until this swap.
            registry.promote(p.shardID, p.artifact);
            logger.info("Pipeline for shard {} run {} SUCCEEDED: {}", p.shardID, p.runID, p.artifact);
            finish(p, PipelineState.SUCCEEDED, null);
        } else if (s == PipelineState.FAILED) {
            Job failed = p.getFailedJob().orElseThrow();
            fail(p, new JobFailedPermanentException(failed.kind, p.shardID, failed.getAttemptCount(),
                    failed.getLastError()));
        }
    }

    private void fail(Pipeline p, GeoShardException failure) {
        stopJobs(p, "Pipeline failed");
        registry.recordBuildFailure(p.shardID);
        logger.error("Pipeline for shard {} run {} FAILED: {}", p.shardID, p.runID, failure.getMessage());
        finish(p, PipelineState.FAILED, failure);
    }

    // Cancel every job of the pipeline that is not finished.
    private void stopJobs(Pipeline p, String reason) {
        for (Job j : p.getJobs()) {
            boolean active = j.getState().isActive();
            String remoteJobID = j.getRemoteJobID();
            boolean stopped = j.getState() != JobState.SUCCEEDED && !j.isFailedPermanently();
            if (stopped) {
                transition(j, () -> j.cancel(reason));
            }
            if (stopped && active && remoteJobID != null) {
                cancelRemote(remoteJobID);
            }
            inFlightJobs.remove(j);
        }
    }

    private void finish(Pipeline p, PipelineState state, GeoShardException failure) {
        activePipelines.remove(p);
        waitingPipelines.remove(p);
        shardPipelines.remove(p.shardID, p);
        p.finish(state, failure);
        for (JobEventListener l : listeners) {
            try {
                l.onPipelineDone(p);
            } catch (RuntimeException e) {
                logger.warn("Pipeline listener failed: {}", e.getMessage());
            }
        }
    }

    private void cancelRemote(String remoteJobID) {
        jobQueueThreadPool.execute(() -> {
            try {
                if (!jobQueue.cancel(remoteJobID)) {
                    logger.warn("Queue did not acknowledge cancelling {}", remoteJobID);
                }
            } catch (RuntimeException e) {
                logger.warn("Cancelling {} failed: {}", remoteJobID, e.getMessage());
            }
        });
    }

    private void transition(Job j, Runnable change) {
        JobState from = j.getState();
        change.run();
        JobState to = j.getState();
        if (from == to) {
            return;
        }
        for (JobEventListener l : listeners) {
            try {
                l.onTransition(j, from, to);
            } catch (RuntimeException e) {
                logger.warn("Job listener failed: {}", e.getMessage());
            }
        }
    }

    // Errors on the scheduling thread would otherwise vanish into a discarded future.
    private static Runnable guarded(Runnable r) {
        return () -> {
            try {
                r.run();
            } catch (RuntimeException e) {
                logger.error("Pipeline scheduler error", e);
            }
        };
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}
