package edu.stanford.futuredata.geoshard.pipeline;

/** Where pipelines write routable graphs. */
public interface ArtifactStore {
    /** Whether a finished artifact exists at this location. */
    boolean exists(String location);
}
