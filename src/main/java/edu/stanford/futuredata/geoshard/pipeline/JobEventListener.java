package edu.stanford.futuredata.geoshard.pipeline;

/**
 * Observes the orchestrator.  Called on the orchestrator's scheduling thread, so implementations must return
 * quickly.
 */
public interface JobEventListener {
    void onTransition(Job job, JobState from, JobState to);

    default void onPipelineDone(Pipeline pipeline) {}
}
