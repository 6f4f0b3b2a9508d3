package edu.stanford.futuredata.geoshard.pipeline;

/** Delay before polling a job again. */
public interface PollBackoff {
    /**
     * @param pollNumber number of polls already made for the current attempt, starting at zero
     */
    long delayMillis(int pollNumber);
}
