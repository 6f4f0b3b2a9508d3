package edu.stanford.futuredata.geoshard.pipeline;

/** Tunables of shard builds. */
public class PipelineConfig {
    // Prefix of each shard's default OSM extract, <sliceLocation><shard>.osm.pbf.
    public String sliceLocation;
    // Prefix of build outputs, <outputLocation><shard>/<run>/.
    public String outputLocation;
    public String profile = "bicycle_paved";
    public AlgorithmMode algorithmMode = AlgorithmMode.CH;
    public int maxAttempts = 3;
    // Jobs SUBMITTED or RUNNING at once, across all pipelines.
    public int maxInFlightJobs = 4;
    public int maxConcurrentPipelines = 3;
    public long initialPollIntervalMillis = 1000;
    public long maxPollIntervalMillis = 60000;
    // Consecutive failed polls after which a job's attempt counts as failed.
    public int maxPollFailures = 10;
    public int jobQueueThreads = 8;

    public PipelineConfig(String sliceLocation, String outputLocation) {
        this.sliceLocation = withSeparator(sliceLocation);
        this.outputLocation = withSeparator(outputLocation);
    }

    /** The S3 layout of the batch deployment: slices/ and processed/ under one bucket. */
    public static PipelineConfig forBucket(String bucket) {
        return new PipelineConfig(String.format("s3://%s/slices/", bucket), String.format("s3://%s/processed/", bucket));
    }

    public PollBackoff pollBackoff() {
        return new ExponentialPollBackoff(initialPollIntervalMillis, maxPollIntervalMillis);
    }

    private static String withSeparator(String location) {
        return location.endsWith("/") ? location : location + "/";
    }
}
