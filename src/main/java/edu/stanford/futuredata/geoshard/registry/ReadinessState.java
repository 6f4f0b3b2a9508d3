package edu.stanford.futuredata.geoshard.registry;

public enum ReadinessState {
    // No routable artifact has been built yet.
    BUILDING,
    READY,
    // Serving an artifact older than the current source data.
    STALE,
    // The first build failed; nothing to serve.
    FAILED;

    public boolean isServing() {
        return this == READY || this == STALE;
    }
}
