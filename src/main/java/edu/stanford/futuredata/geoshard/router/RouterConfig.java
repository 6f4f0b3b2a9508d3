package edu.stanford.futuredata.geoshard.router;

/** Tunables of the query-serving side. */
public class RouterConfig {
    // Maximum distance between the end of one stitched piece and the start of the next.
    public double snapToleranceMeters = 30.0;
    // How far outside both shards' boxes a gateway candidate may lie.
    public double gatewayBufferDegrees = 0.5;
    public int maxGatewayCandidates = 9;
    // Relative cost difference under which two gateway candidates count as equal.
    public double gatewayCostEpsilon = 1e-6;
    public long engineTimeoutMillis = 5000;
    // Deadline for a whole cross-shard query, gateway selection included.
    public long crossShardTimeoutMillis = 60000;
    public int queryThreads = 64;
}
